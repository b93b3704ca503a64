package com.officeduty.backend.modules.duty.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link DutyType} as its lowercase wire value ({@code coffee}/{@code fridge}).
 */
@Converter(autoApply = true)
public class DutyTypeConverter implements AttributeConverter<DutyType, String> {

    @Override
    public String convertToDatabaseColumn(DutyType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public DutyType convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return DutyType.fromValue(dbData)
                .orElseThrow(() -> new IllegalStateException("Unknown duty_type in database: " + dbData));
    }
}

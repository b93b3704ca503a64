package com.officeduty.backend.modules.duty.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * {@code duty_id} arrives as the string the listing handed out, but a JSON number is accepted too.
 */
public record DutyCompletionRequest(
        @NotNull
        @Pattern(regexp = "\\s*[1-9][0-9]{0,17}\\s*", message = "must be a positive integer")
        String dutyId,

        @NotBlank
        @Pattern(regexp = "(?i)\\s*(coffee|fridge)\\s*", message = "must be one of: coffee, fridge")
        String dutyType
) {
}

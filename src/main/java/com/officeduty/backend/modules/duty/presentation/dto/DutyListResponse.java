package com.officeduty.backend.modules.duty.presentation.dto;

import java.util.List;

public record DutyListResponse(
        List<DutyResponse> duties,
        int total
) {

    public static DutyListResponse of(List<DutyResponse> duties) {
        return new DutyListResponse(duties, duties.size());
    }
}

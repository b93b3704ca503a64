package com.officeduty.backend.modules.duty.presentation.dto;

import java.util.List;

public record DutyCompletionResponse(
        String message,
        boolean success,
        List<DutyResponse> duties
) {

    public static DutyCompletionResponse of(String message, List<DutyResponse> duties) {
        return new DutyCompletionResponse(message, true, duties);
    }
}

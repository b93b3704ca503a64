package com.officeduty.backend.modules.duty.presentation.dto;

public record RecentDutyResponse(
        DutyResponse duty
) {
}

package com.officeduty.backend.modules.duty.presentation.dto;

import com.officeduty.backend.modules.duty.domain.DutyType;

/**
 * Wire shape of one assignment. Ids are strings because the board client keys rows by them.
 */
public record DutyResponse(
        String dutyId,
        DutyType dutyType,
        String userId,
        String username,
        String name,
        String selectionTimestamp,
        int cycleId,
        boolean completed,
        String completedTimestamp
) {
}

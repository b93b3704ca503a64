package com.officeduty.backend.modules.duty.presentation.dto;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

import com.officeduty.backend.modules.duty.domain.DutyAssignment;
import com.officeduty.backend.modules.member.domain.Member;

public final class DutyDtoMapper {

    private DutyDtoMapper() {
    }

    public static DutyResponse toResponse(DutyAssignment assignment) {
        Member member = assignment.getMember();
        return new DutyResponse(
                String.valueOf(assignment.getId()),
                assignment.getDutyType(),
                String.valueOf(member.getId()),
                member.getUsername(),
                member.getDisplayName(),
                format(assignment.getAssignedAt()),
                assignment.getCycleId(),
                assignment.isCompleted(),
                format(assignment.getCompletedAt())
        );
    }

    private static String format(OffsetDateTime timestamp) {
        return timestamp != null ? DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(timestamp) : null;
    }
}

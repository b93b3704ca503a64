package com.officeduty.backend.modules.member.presentation.dto;

import java.util.Locale;

import com.officeduty.backend.modules.member.domain.MemberStatus;

public enum MemberStatusFilter {
    ACTIVE(MemberStatus.ACTIVE),
    INACTIVE(MemberStatus.INACTIVE),
    ALL(null);

    private final MemberStatus mappedStatus;

    MemberStatusFilter(MemberStatus mappedStatus) {
        this.mappedStatus = mappedStatus;
    }

    public MemberStatus toMemberStatus() {
        return mappedStatus;
    }

    public static MemberStatusFilter from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (MemberStatusFilter value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unsupported status filter: " + raw);
    }
}

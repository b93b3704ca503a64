package com.officeduty.backend.modules.member.domain;

public enum MemberStatus {
    ACTIVE,
    INACTIVE;

    public boolean isActive() {
        return this == ACTIVE;
    }

    public static MemberStatus fromActiveFlag(boolean active) {
        return active ? ACTIVE : INACTIVE;
    }
}

package com.officeduty.backend.modules.member.presentation.dto;

import com.officeduty.backend.modules.member.domain.Member;

public record MemberResponse(
        Long id,
        String username,
        String fullName,
        boolean coffeeDrinker,
        boolean active
) {

    public static MemberResponse from(Member member) {
        return new MemberResponse(
                member.getId(),
                member.getUsername(),
                member.getFullName(),
                member.isCoffeeDrinker(),
                member.isActive()
        );
    }
}

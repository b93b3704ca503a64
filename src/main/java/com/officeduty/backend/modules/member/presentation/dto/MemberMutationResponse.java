package com.officeduty.backend.modules.member.presentation.dto;

import java.util.List;

/**
 * Result of a roster write: the client re-renders from the returned active roster.
 */
public record MemberMutationResponse(
        String message,
        boolean success,
        List<MemberResponse> members
) {

    public static MemberMutationResponse of(String message, List<MemberResponse> members) {
        return new MemberMutationResponse(message, true, members);
    }
}

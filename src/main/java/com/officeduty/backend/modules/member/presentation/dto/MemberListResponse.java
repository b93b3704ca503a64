package com.officeduty.backend.modules.member.presentation.dto;

import java.util.List;

public record MemberListResponse(
        List<MemberResponse> members
) {
}

package com.officeduty.backend.modules.member.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateMemberRequest(
        @NotBlank @Size(max = 50) String username,
        @NotBlank @Size(max = 100) String fullName,
        Boolean coffeeDrinker
) {
}

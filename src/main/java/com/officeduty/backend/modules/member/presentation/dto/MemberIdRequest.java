package com.officeduty.backend.modules.member.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record MemberIdRequest(
        @NotNull @Positive Long id
) {
}

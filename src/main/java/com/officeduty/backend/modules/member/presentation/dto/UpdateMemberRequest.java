package com.officeduty.backend.modules.member.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields keep their stored value. Fields that are sent must not be blank.
 */
public record UpdateMemberRequest(
        @NotNull @Positive Long id,
        @Size(max = 50) @Pattern(regexp = NOT_BLANK, message = "must not be blank") String username,
        @Size(max = 100) @Pattern(regexp = NOT_BLANK, message = "must not be blank") String fullName,
        Boolean coffeeDrinker
) {

    static final String NOT_BLANK = "(?s).*\\S.*";
}

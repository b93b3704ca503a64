package com.officeduty.backend.global.error;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        List<FieldViolation> errors
) {

    public static final String VALIDATION_ERROR = "validation_error";

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:office-duty:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        return of(httpStatus, code, detail, instance, List.of());
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance,
                                     List<FieldViolation> errors) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name().toLowerCase();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                DEFAULT_TYPE_PREFIX + normalized,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode,
                errors != null ? errors : List.of()
        );
    }

    public record FieldViolation(String field, String message) {
    }
}

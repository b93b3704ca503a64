package com.officeduty.backend.global.error;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Domain failure carrying a stable machine-readable code, rendered as a {@link ProblemResponse}.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;
    private final List<ProblemResponse.FieldViolation> violations;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, List.of());
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, List.of());
    }

    public ProblemException(HttpStatus status, String code, String detail,
                            List<ProblemResponse.FieldViolation> violations) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(HttpStatus.NOT_FOUND, code, detail);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(HttpStatus.CONFLICT, code, detail);
    }

    public static ProblemException invalid(String field, String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, ProblemResponse.VALIDATION_ERROR, detail,
                List.of(new ProblemResponse.FieldViolation(field, detail)));
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public List<ProblemResponse.FieldViolation> getViolations() {
        return violations;
    }
}

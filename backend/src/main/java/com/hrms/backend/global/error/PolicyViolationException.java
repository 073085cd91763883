package com.hrms.backend.global.error;

import java.util.List;

import org.springframework.http.HttpStatus;

/**
 * Rejection that carries every failed rule, not just the first one.
 */
public class PolicyViolationException extends ProblemException {

    private final List<String> violations;

    public PolicyViolationException(String code, String detail, List<String> violations) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, code, detail);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}

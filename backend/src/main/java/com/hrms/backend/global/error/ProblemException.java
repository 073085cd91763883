package com.hrms.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Failure with a stable machine-readable code. The problem type is {@code urn:problem:hrms:<code>}.
 */
public class ProblemException extends ResponseStatusException {

    public static final String TYPE_PREFIX = "urn:problem:hrms:";

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, requireCode(code), cause);
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public static String typeFor(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9\\-_.]+", "-");
    }

    private static String requireCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        return code;
    }
}

package com.hrms.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.hrms.backend.global.config.SecurityProperties;

import org.springframework.stereotype.Component;

/**
 * Password strength rules. Every failed rule is reported.
 */
@Component
public class PasswordPolicy {

    /** BCrypt ignores input beyond this many bytes. */
    static final int MAX_BYTES = 72;

    private final int minLength;

    public PasswordPolicy(SecurityProperties properties) {
        this.minLength = properties.getPassword().getMinLength();
    }

    public List<PasswordViolation> validate(String password) {
        List<PasswordViolation> violations = new ArrayList<>();
        String candidate = password == null ? "" : password;

        if (candidate.codePointCount(0, candidate.length()) < minLength) {
            violations.add(PasswordViolation.TOO_SHORT);
        }
        if (candidate.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            violations.add(PasswordViolation.TOO_LONG);
        }

        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean symbol = false;
        for (int i = 0; i < candidate.length(); ) {
            int cp = candidate.codePointAt(i);
            if (Character.isUpperCase(cp)) {
                upper = true;
            } else if (Character.isLowerCase(cp)) {
                lower = true;
            } else if (Character.isDigit(cp)) {
                digit = true;
            } else if (!Character.isWhitespace(cp) && !Character.isLetter(cp)) {
                symbol = true;
            }
            i += Character.charCount(cp);
        }
        if (!upper) {
            violations.add(PasswordViolation.MISSING_UPPERCASE);
        }
        if (!lower) {
            violations.add(PasswordViolation.MISSING_LOWERCASE);
        }
        if (!digit) {
            violations.add(PasswordViolation.MISSING_DIGIT);
        }
        if (!symbol) {
            violations.add(PasswordViolation.MISSING_SYMBOL);
        }
        return violations;
    }

    public void enforce(String password) {
        List<PasswordViolation> violations = validate(password);
        if (!violations.isEmpty()) {
            throw AuthProblems.passwordPolicyViolation(violations.stream().map(Enum::name).toList());
        }
    }
}

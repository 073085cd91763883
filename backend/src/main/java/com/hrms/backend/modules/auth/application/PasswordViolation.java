package com.hrms.backend.modules.auth.application;

public enum PasswordViolation {
    TOO_SHORT,
    TOO_LONG,
    MISSING_UPPERCASE,
    MISSING_LOWERCASE,
    MISSING_DIGIT,
    MISSING_SYMBOL
}

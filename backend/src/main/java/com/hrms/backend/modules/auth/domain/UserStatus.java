package com.hrms.backend.modules.auth.domain;

public enum UserStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    PENDING
}

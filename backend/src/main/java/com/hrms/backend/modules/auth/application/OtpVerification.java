package com.hrms.backend.modules.auth.application;

public enum OtpVerification {
    OK,
    EXPIRED,
    INVALID
}

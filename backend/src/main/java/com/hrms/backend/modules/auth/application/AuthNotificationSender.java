package com.hrms.backend.modules.auth.application;

import java.time.Duration;

import com.hrms.backend.modules.auth.domain.OtpPurpose;

/**
 * Outbound delivery of verification codes and reset links. The plain-text code only ever leaves
 * the service through this port.
 */
public interface AuthNotificationSender {

    void sendOtp(String email, OtpPurpose purpose, String code, Duration ttl);

    void sendPasswordReset(String email, String resetLink, Duration ttl);
}

package com.hrms.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;

import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.global.error.ProblemException;
import com.hrms.backend.modules.auth.domain.OtpPurpose;
import com.hrms.backend.modules.auth.infrastructure.persistence.CredentialStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Self-service verification codes. Sending answers the same way whether or not the account
 * exists.
 */
@Service
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final OtpService otpService;
    private final RateLimiterService rateLimiterService;
    private final CredentialStore credentialStore;
    private final SecurityProperties.Otp settings;
    private final Clock clock;

    public VerificationService(
            OtpService otpService,
            RateLimiterService rateLimiterService,
            CredentialStore credentialStore,
            SecurityProperties properties,
            Clock clock
    ) {
        this.otpService = otpService;
        this.rateLimiterService = rateLimiterService;
        this.credentialStore = credentialStore;
        this.settings = properties.getOtp();
        this.clock = clock;
    }

    /**
     * @return nominal expiry of the code, reported even when no code was sent
     */
    public Instant sendCode(String email, OtpPurpose purpose) {
        requireSelfService(purpose);
        String normalizedEmail = CredentialStore.normalizeEmail(email);

        RateLimitDecision decision = rateLimiterService.checkIdentifier(
                "otp:" + purpose.key(), normalizedEmail, settings.getSendLimit(), settings.getSendWindow());
        if (!decision.allowed()) {
            log.warn("Too many {} code requests for {}", purpose.key(), normalizedEmail);
            throw AuthProblems.rateLimited(decision.retryAfter(clock.instant()));
        }

        boolean known = credentialStore.findByEmail(normalizedEmail).isPresent();
        if (!known) {
            log.info("Ignored {} code request for unknown account", purpose.key());
            return clock.instant().plus(settings.getTtl());
        }
        return otpService.issue(normalizedEmail, purpose);
    }

    public void verifyCode(String email, OtpPurpose purpose, String code) {
        requireSelfService(purpose);
        String normalizedEmail = CredentialStore.normalizeEmail(email);

        OtpVerification result = otpService.verify(normalizedEmail, purpose, code);
        if (result == OtpVerification.EXPIRED) {
            throw AuthProblems.otpExpired();
        }
        if (result == OtpVerification.INVALID) {
            throw AuthProblems.otpInvalid();
        }
        if (purpose == OtpPurpose.EMAIL_VERIFICATION && credentialStore.markEmailVerified(normalizedEmail)) {
            log.info("Email verified for {}", normalizedEmail);
        }
    }

    private static void requireSelfService(OtpPurpose purpose) {
        if (purpose == null || !purpose.isSelfService()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "OTP_PURPOSE_UNSUPPORTED",
                    "This verification purpose cannot be requested directly");
        }
    }
}

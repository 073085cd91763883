package com.hrms.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import com.hrms.backend.global.common.Digests;
import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.modules.auth.domain.OtpPurpose;
import com.hrms.backend.modules.auth.infrastructure.cache.CacheKeys;
import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache;
import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache.ChallengeOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One-time numeric codes keyed by identity and purpose. Only a digest of the code is cached;
 * the plain code goes to the notification sender and nowhere else.
 */
@Service
public class OtpService {

    private static final Logger log = LoggerFactory.getLogger(OtpService.class);

    private final SecurityCache cache;
    private final AuthNotificationSender notificationSender;
    private final SecurityProperties.Otp settings;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public OtpService(
            SecurityCache cache,
            AuthNotificationSender notificationSender,
            SecurityProperties properties,
            Clock clock
    ) {
        this.cache = cache;
        this.notificationSender = notificationSender;
        this.settings = properties.getOtp();
        this.clock = clock;
    }

    public String generate(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("OTP length must be positive");
        }
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(random.nextInt(10));
        }
        return code.toString();
    }

    public Instant issue(String identity, OtpPurpose purpose) {
        return issue(identity, purpose, settings.getTtl());
    }

    /**
     * Stores a new code, replacing any live code for the same identity and purpose, and hands it
     * to the notification sender.
     *
     * @return expiry of the issued code
     */
    public Instant issue(String identity, OtpPurpose purpose, Duration ttl) {
        String normalized = normalize(identity);
        String code = generate(settings.getLength());
        cache.putChallenge(key(normalized, purpose), digest(normalized, purpose, code), ttl);
        notificationSender.sendOtp(normalized, purpose, code, ttl);
        log.info("Issued {} code for {}", purpose.key(), normalized);
        return clock.instant().plus(ttl);
    }

    public OtpVerification verify(String identity, OtpPurpose purpose, String submittedCode) {
        String normalized = normalize(identity);
        String submitted = submittedCode == null ? "" : submittedCode.trim();
        ChallengeOutcome outcome = cache.consumeChallenge(
                key(normalized, purpose),
                digest(normalized, purpose, submitted),
                settings.getMaxAttempts()
        );
        OtpVerification result = switch (outcome) {
            case MATCHED -> OtpVerification.OK;
            case MISSING -> OtpVerification.EXPIRED;
            case MISMATCHED, EXHAUSTED -> OtpVerification.INVALID;
        };
        if (outcome == ChallengeOutcome.EXHAUSTED) {
            log.warn("Destroyed {} code for {} after too many wrong attempts", purpose.key(), normalized);
        } else {
            log.info("Verified {} code for {}: {}", purpose.key(), normalized, result);
        }
        return result;
    }

    static String key(String normalizedIdentity, OtpPurpose purpose) {
        return CacheKeys.OTP + purpose.key() + ":" + normalizedIdentity;
    }

    static String normalize(String identity) {
        return identity == null ? "" : identity.trim().toLowerCase(Locale.ROOT);
    }

    private static String digest(String identity, OtpPurpose purpose, String code) {
        return Digests.sha256Hex(purpose.key() + ":" + identity + ":" + code);
    }
}

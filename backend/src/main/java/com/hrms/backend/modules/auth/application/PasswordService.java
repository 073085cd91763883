package com.hrms.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.UUID;

import com.hrms.backend.global.common.Digests;
import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.modules.auth.application.LoginAttemptGovernor.AttemptScope;
import com.hrms.backend.modules.auth.application.LoginAttemptGovernor.LockStatus;
import com.hrms.backend.modules.auth.domain.PasswordResetToken;
import com.hrms.backend.modules.auth.domain.UserAccount;
import com.hrms.backend.modules.auth.infrastructure.persistence.CredentialStore;
import com.hrms.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Forgot/reset and change-password flows. Every successful password change revokes all live
 * sessions of the user.
 */
@Service
public class PasswordService {

    private static final Logger log = LoggerFactory.getLogger(PasswordService.class);
    private static final int RESET_TOKEN_BYTES = 32;
    static final String REASON_PASSWORD_RESET = "PASSWORD_RESET";
    static final String REASON_PASSWORD_CHANGED = "PASSWORD_CHANGED";

    private final CredentialStore credentialStore;
    private final PasswordResetTokenRepository resetTokenRepository;
    private final PasswordPolicy passwordPolicy;
    private final PasswordHasher passwordHasher;
    private final SessionRegistry sessionRegistry;
    private final LoginAttemptGovernor attemptGovernor;
    private final RateLimiterService rateLimiterService;
    private final AuthNotificationSender notificationSender;
    private final SecurityProperties properties;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public PasswordService(
            CredentialStore credentialStore,
            PasswordResetTokenRepository resetTokenRepository,
            PasswordPolicy passwordPolicy,
            PasswordHasher passwordHasher,
            SessionRegistry sessionRegistry,
            LoginAttemptGovernor attemptGovernor,
            RateLimiterService rateLimiterService,
            AuthNotificationSender notificationSender,
            SecurityProperties properties,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.resetTokenRepository = resetTokenRepository;
        this.passwordPolicy = passwordPolicy;
        this.passwordHasher = passwordHasher;
        this.sessionRegistry = sessionRegistry;
        this.attemptGovernor = attemptGovernor;
        this.rateLimiterService = rateLimiterService;
        this.notificationSender = notificationSender;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Sends a reset link when the account exists and is active. Callers get no signal either way.
     */
    @Transactional
    public void requestReset(String email) {
        String normalizedEmail = CredentialStore.normalizeEmail(email);
        SecurityProperties.Otp otp = properties.getOtp();
        RateLimitDecision decision = rateLimiterService.checkIdentifier(
                "password_reset", normalizedEmail, otp.getSendLimit(), otp.getSendWindow());
        if (!decision.allowed()) {
            throw AuthProblems.rateLimited(decision.retryAfter(clock.instant()));
        }

        UserAccount user = credentialStore.findByEmail(normalizedEmail).orElse(null);
        if (user == null || !user.isActive()) {
            log.info("Password reset requested for unknown or inactive account");
            return;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        resetTokenRepository.invalidateOutstanding(user.getId(), now);

        String rawToken = newRawToken();
        PasswordResetToken token = new PasswordResetToken();
        token.setUser(user);
        token.setTokenHash(Digests.sha256Hex(rawToken));
        token.setExpiresAt(now.plus(properties.getPasswordReset().getTtl()));
        resetTokenRepository.save(token);

        String link = UriComponentsBuilder.fromHttpUrl(properties.getPasswordReset().getFrontendUrl())
                .path("/reset-password")
                .queryParam("token", rawToken)
                .build()
                .toUriString();
        notificationSender.sendPasswordReset(user.getEmail(), link, properties.getPasswordReset().getTtl());
        log.info("Issued password reset token for user {}", user.getId());
    }

    @Transactional
    public void resetPassword(String rawToken, String newPassword) {
        passwordPolicy.enforce(newPassword);
        if (rawToken == null || rawToken.isBlank()) {
            throw AuthProblems.resetTokenInvalid();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        PasswordResetToken token = resetTokenRepository.findByTokenHashForUpdate(Digests.sha256Hex(rawToken.trim()))
                .orElseThrow(AuthProblems::resetTokenInvalid);
        if (!token.isUsableAt(now)) {
            throw AuthProblems.resetTokenInvalid();
        }
        UserAccount user = token.getUser();
        if (!user.isActive()) {
            throw AuthProblems.resetTokenInvalid();
        }

        token.setUsedAt(now);
        resetTokenRepository.invalidateOutstanding(user.getId(), now);
        credentialStore.updatePassword(user, passwordHasher.hash(newPassword));
        credentialStore.clearFailedLogins(user.getEmail());
        attemptGovernor.clear(AttemptScope.ACCOUNT, user.getEmail());
        sessionRegistry.revokeAllForUser(user.getId(), REASON_PASSWORD_RESET);
        log.info("Password reset completed for user {}", user.getId());
    }

    @Transactional
    public void changePassword(UUID userId, String currentPassword, String newPassword) {
        UserAccount user = credentialStore.findById(userId)
                .filter(UserAccount::isActive)
                .orElseThrow(AuthProblems::accountInactive);
        LockStatus lock = attemptGovernor.status(AttemptScope.ACCOUNT, user.getEmail());
        if (lock.locked()) {
            log.warn("Password change refused for locked user {}", userId);
            throw AuthProblems.accountLocked(lock.remaining());
        }
        if (!passwordHasher.verify(currentPassword, user.getPasswordHash())) {
            registerFailure(user.getEmail());
            log.info("Password change rejected for user {}: bad current password", userId);
            throw AuthProblems.invalidCredentials();
        }
        passwordPolicy.enforce(newPassword);

        credentialStore.updatePassword(user, passwordHasher.hash(newPassword));
        sessionRegistry.revokeAllForUser(user.getId(), REASON_PASSWORD_CHANGED);
        log.info("Password changed for user {}", userId);
    }

    private void registerFailure(String email) {
        long failures = attemptGovernor.recordFailure(AttemptScope.ACCOUNT, email);
        OffsetDateTime lockedUntil = failures >= attemptGovernor.threshold(AttemptScope.ACCOUNT)
                ? OffsetDateTime.now(clock).plus(attemptGovernor.lockoutDuration())
                : null;
        try {
            credentialStore.recordFailedLogin(email, failures, lockedUntil);
        } catch (DataAccessException ex) {
            log.warn("Could not mirror failed password check for {}: {}", email, ex.getMessage());
        }
    }

    private String newRawToken() {
        byte[] bytes = new byte[RESET_TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}

package com.hrms.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.hrms.backend.global.web.ClientContext;
import com.hrms.backend.modules.auth.application.LoginAttemptGovernor.AttemptScope;
import com.hrms.backend.modules.auth.application.LoginAttemptGovernor.LockStatus;
import com.hrms.backend.modules.auth.domain.OtpPurpose;
import com.hrms.backend.modules.auth.domain.TokenType;
import com.hrms.backend.modules.auth.domain.UserAccount;
import com.hrms.backend.modules.auth.infrastructure.persistence.CredentialStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Login, two-factor completion, refresh rotation and logout.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_ROTATED = "ROTATED";

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final LoginAttemptGovernor attemptGovernor;
    private final OtpService otpService;
    private final JwtTokenService jwtTokenService;
    private final SessionRegistry sessionRegistry;
    private final PermissionResolver permissionResolver;
    private final Clock clock;

    public AuthService(
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            LoginAttemptGovernor attemptGovernor,
            OtpService otpService,
            JwtTokenService jwtTokenService,
            SessionRegistry sessionRegistry,
            PermissionResolver permissionResolver,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.attemptGovernor = attemptGovernor;
        this.otpService = otpService;
        this.jwtTokenService = jwtTokenService;
        this.sessionRegistry = sessionRegistry;
        this.permissionResolver = permissionResolver;
        this.clock = clock;
    }

    public LoginResult login(String email, String password, ClientContext client) {
        String normalizedEmail = CredentialStore.normalizeEmail(email);
        ensureNotLocked(normalizedEmail, client);

        UserAccount user = credentialStore.findByEmail(normalizedEmail).orElse(null);
        if (user == null) {
            passwordHasher.verifyAgainstDummy(password);
            registerFailure(normalizedEmail, client, false);
            log.info("Login failed for {}: unknown account", normalizedEmail);
            throw AuthProblems.invalidCredentials();
        }
        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            registerFailure(normalizedEmail, client, true);
            log.info("Login failed for {}: bad password", normalizedEmail);
            throw AuthProblems.invalidCredentials();
        }
        if (!user.isActive()) {
            log.info("Login refused for {}: status {}", normalizedEmail, user.getStatus());
            throw AuthProblems.accountInactive();
        }

        if (user.isTwoFactorEnabled()) {
            Instant expiresAt = otpService.issue(normalizedEmail, OtpPurpose.TWO_FACTOR);
            log.info("Login for {} requires two-factor verification", normalizedEmail);
            return LoginResult.twoFactorRequired(user, expiresAt);
        }

        LoginResult result = completeLogin(user, client);
        upgradeHashIfNeeded(user, password);
        return result;
    }

    public LoginResult verifyTwoFactor(String email, String code, ClientContext client) {
        String normalizedEmail = CredentialStore.normalizeEmail(email);
        ensureNotLocked(normalizedEmail, client);

        OtpVerification verification = otpService.verify(normalizedEmail, OtpPurpose.TWO_FACTOR, code);
        if (verification == OtpVerification.EXPIRED) {
            throw AuthProblems.otpExpired();
        }
        if (verification == OtpVerification.INVALID) {
            registerFailure(normalizedEmail, client, true);
            throw AuthProblems.otpInvalid();
        }

        UserAccount user = credentialStore.findByEmail(normalizedEmail)
                .orElseThrow(AuthProblems::invalidCredentials);
        if (!user.isActive()) {
            throw AuthProblems.accountInactive();
        }
        return completeLogin(user, client);
    }

    /**
     * Rotate-and-revoke: the presented refresh token's session is revoked before a new pair is
     * issued. Only one of several concurrent refreshes with the same token can win the revocation.
     * A rotation that fails after winning releases the revocation so the old token stays usable.
     */
    @Transactional
    public LoginResult refresh(String refreshToken, ClientContext client) {
        TokenClaims claims = jwtTokenService.validate(refreshToken, TokenType.REFRESH);
        if (sessionRegistry.isRevoked(claims.sessionId())) {
            log.warn("Refresh rejected for revoked session {}", claims.sessionId());
            throw AuthProblems.sessionRevoked();
        }

        UserAccount user = credentialStore.findById(claims.userId())
                .orElseThrow(AuthProblems::tokenInvalid);
        if (!user.isActive()) {
            throw AuthProblems.accountInactive();
        }

        if (!sessionRegistry.revokeOnce(claims.sessionId(), sessionRegistry.remaining(claims.expiresAt()))) {
            log.warn("Refresh token replay detected for session {}", claims.sessionId());
            throw AuthProblems.sessionRevoked();
        }
        sessionRegistry.releaseOnRollback(claims.sessionId());
        try {
            sessionRegistry.revokeSession(claims.sessionId(), claims.expiresAt(), REASON_ROTATED);

            PermissionSet permissions = permissionResolver.resolve(user.getId());
            IssuedTokenPair tokens = jwtTokenService.issuePair(user.getId(), user.getEmail(),
                    permissions.roles(), permissions.permissions());
            sessionRegistry.storeSession(user, tokens, client);
            log.info("Rotated session {} -> {} for user {}", claims.sessionId(), tokens.sessionId(), user.getId());
            return LoginResult.authenticated(user, tokens, permissions);
        } catch (RuntimeException ex) {
            log.warn("Rotation of session {} failed, releasing its revocation: {}", claims.sessionId(), ex.getMessage());
            try {
                sessionRegistry.release(claims.sessionId());
            } catch (RuntimeException releaseFailure) {
                ex.addSuppressed(releaseFailure);
            }
            throw ex;
        }
    }

    public void logout(UUID userId, UUID sessionId) {
        sessionRegistry.revokeSession(sessionId, REASON_LOGOUT, jwtTokenService.getRefreshTtl());
        permissionResolver.evict(userId);
        log.info("User {} logged out of session {}", userId, sessionId);
    }

    public UserAccount loadActiveUser(UUID userId) {
        return credentialStore.findById(userId)
                .filter(UserAccount::isActive)
                .orElseThrow(AuthProblems::accountInactive);
    }

    private LoginResult completeLogin(UserAccount user, ClientContext client) {
        attemptGovernor.clear(AttemptScope.ACCOUNT, user.getEmail());
        PermissionSet permissions = permissionResolver.resolve(user.getId());
        IssuedTokenPair tokens = jwtTokenService.issuePair(user.getId(), user.getEmail(),
                permissions.roles(), permissions.permissions());
        sessionRegistry.storeSession(user, tokens, client);

        try {
            credentialStore.recordSuccessfulLogin(user.getId(), client == null ? null : client.ipAddress());
        } catch (DataAccessException ex) {
            log.warn("Could not record login bookkeeping for user {}: {}", user.getId(), ex.getMessage());
        }
        log.info("User {} logged in, session {}", user.getId(), tokens.sessionId());
        return LoginResult.authenticated(user, tokens, permissions);
    }

    private void upgradeHashIfNeeded(UserAccount user, String password) {
        if (!passwordHasher.needsRehash(user.getPasswordHash())) {
            return;
        }
        try {
            credentialStore.upgradePasswordHash(user.getId(), passwordHasher.hash(password));
            log.info("Upgraded password hash cost for user {}", user.getId());
        } catch (DataAccessException ex) {
            log.warn("Could not upgrade password hash for user {}: {}", user.getId(), ex.getMessage());
        }
    }

    private void ensureNotLocked(String normalizedEmail, ClientContext client) {
        String ip = client == null ? null : client.ipAddress();
        if (ip != null) {
            LockStatus ipStatus = attemptGovernor.status(AttemptScope.CLIENT_IP, ip);
            if (ipStatus.locked()) {
                log.warn("Rejected attempt from locked address {}", ip);
                throw AuthProblems.accountLocked(ipStatus.remaining());
            }
        }
        LockStatus accountStatus = attemptGovernor.status(AttemptScope.ACCOUNT, normalizedEmail);
        if (accountStatus.locked()) {
            log.warn("Rejected attempt for locked account {}", normalizedEmail);
            throw AuthProblems.accountLocked(accountStatus.remaining());
        }
    }

    private void registerFailure(String normalizedEmail, ClientContext client, boolean knownAccount) {
        long failures = attemptGovernor.recordFailure(AttemptScope.ACCOUNT, normalizedEmail);
        if (client != null && client.ipAddress() != null) {
            attemptGovernor.recordFailure(AttemptScope.CLIENT_IP, client.ipAddress());
        }
        if (!knownAccount) {
            return;
        }
        OffsetDateTime lockedUntil = failures >= attemptGovernor.threshold(AttemptScope.ACCOUNT)
                ? OffsetDateTime.now(clock).plus(attemptGovernor.lockoutDuration())
                : null;
        try {
            credentialStore.recordFailedLogin(normalizedEmail, failures, lockedUntil);
        } catch (DataAccessException ex) {
            log.warn("Could not mirror failed login for {}: {}", normalizedEmail, ex.getMessage());
        }
    }
}

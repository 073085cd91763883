package com.hrms.backend.modules.auth.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.hrms.backend.modules.auth.domain.UserAccount;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Relational side of credentials: lookups, login bookkeeping and password updates.
 * Bookkeeping writes run in their own transaction so that a failure there never rolls back the
 * authentication outcome.
 */
@Component
public class CredentialStore {

    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    public CredentialStore(UserAccountRepository userAccountRepository, Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.clock = clock;
    }

    public static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> findByEmail(String email) {
        String normalized = normalizeEmail(email);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return userAccountRepository.findActiveByEmail(normalized);
    }

    @Transactional(readOnly = true)
    public Optional<UserAccount> findById(UUID id) {
        return userAccountRepository.findActiveById(id);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordSuccessfulLogin(UUID userId, String ip) {
        userAccountRepository.recordSuccessfulLogin(userId, now(), ip);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailedLogin(String email, long failures, OffsetDateTime lockedUntil) {
        userAccountRepository.recordFailedLogin(normalizeEmail(email), (int) Math.min(failures, Integer.MAX_VALUE), lockedUntil);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void upgradePasswordHash(UUID userId, String newHash) {
        userAccountRepository.findById(userId).ifPresent(user -> user.setPasswordHash(newHash));
    }

    @Transactional
    public void clearFailedLogins(String email) {
        userAccountRepository.clearFailedLogins(normalizeEmail(email));
    }

    @Transactional
    public void updatePassword(UserAccount user, String newHash) {
        user.setPasswordHash(newHash);
        user.setPasswordChangedAt(now());
        userAccountRepository.save(user);
    }

    @Transactional
    public boolean markEmailVerified(String email) {
        return userAccountRepository.findActiveByEmail(normalizeEmail(email))
                .map(user -> {
                    if (user.getEmailVerifiedAt() == null) {
                        user.setEmailVerifiedAt(now());
                    }
                    return true;
                })
                .orElse(false);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}

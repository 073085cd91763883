package com.hrms.backend.modules.auth.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * BCrypt hashing with the configured cost. The cost is read from each stored hash on
 * verification, so raising it keeps older hashes valid.
 */
@Component
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode("timing-equalisation-placeholder");
    }

    public String hash(String rawPassword) {
        return passwordEncoder.encode(rawPassword);
    }

    public boolean verify(String rawPassword, String hash) {
        if (rawPassword == null || hash == null || hash.isBlank()) {
            return false;
        }
        return passwordEncoder.matches(rawPassword, hash);
    }

    /**
     * Spends the same work as a real verification for identities that do not exist.
     */
    public void verifyAgainstDummy(String rawPassword) {
        passwordEncoder.matches(rawPassword == null ? "" : rawPassword, dummyHash);
    }

    public boolean needsRehash(String hash) {
        return hash != null && passwordEncoder.upgradeEncoding(hash);
    }
}

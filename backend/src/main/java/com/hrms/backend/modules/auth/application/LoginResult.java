package com.hrms.backend.modules.auth.application;

import java.time.Instant;

import com.hrms.backend.modules.auth.domain.UserAccount;

/**
 * Outcome of a password login: either a token pair or a pending two-factor challenge.
 */
public record LoginResult(
        UserAccount user,
        IssuedTokenPair tokens,
        PermissionSet permissions,
        Instant challengeExpiresAt
) {

    public static LoginResult authenticated(UserAccount user, IssuedTokenPair tokens, PermissionSet permissions) {
        return new LoginResult(user, tokens, permissions, null);
    }

    public static LoginResult twoFactorRequired(UserAccount user, Instant challengeExpiresAt) {
        return new LoginResult(user, null, null, challengeExpiresAt);
    }

    public boolean requiresTwoFactor() {
        return tokens == null;
    }
}

package com.hrms.backend.modules.auth.application;

import java.time.Duration;
import java.util.List;

import com.hrms.backend.global.error.PolicyViolationException;
import com.hrms.backend.global.error.ProblemException;
import com.hrms.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * Problem codes surfaced by the authentication core. Credential failures share one code so that
 * callers cannot tell an unknown account from a wrong password.
 */
public final class AuthProblems {

    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String ACCOUNT_LOCKED = "ACCOUNT_LOCKED";
    public static final String ACCOUNT_INACTIVE = "ACCOUNT_INACTIVE";
    public static final String TOKEN_EXPIRED = "TOKEN_EXPIRED";
    public static final String TOKEN_INVALID = "TOKEN_INVALID";
    public static final String SESSION_REVOKED = "SESSION_REVOKED";
    public static final String OTP_EXPIRED = "OTP_EXPIRED";
    public static final String OTP_INVALID = "OTP_INVALID";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String PERMISSION_DENIED = "PERMISSION_DENIED";
    public static final String PASSWORD_POLICY_VIOLATION = "PASSWORD_POLICY_VIOLATION";
    public static final String RESET_TOKEN_INVALID = "RESET_TOKEN_INVALID";
    public static final String SECURITY_BACKEND_UNAVAILABLE = "SECURITY_BACKEND_UNAVAILABLE";

    private AuthProblems() {
    }

    public static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid email or password");
    }

    public static RetryableProblemException accountLocked(Duration remaining) {
        return new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, ACCOUNT_LOCKED,
                "Too many failed attempts, try again later", roundUpSeconds(remaining));
    }

    public static ProblemException accountInactive() {
        return new ProblemException(HttpStatus.FORBIDDEN, ACCOUNT_INACTIVE, "Account is not active");
    }

    public static ProblemException tokenExpired() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, TOKEN_EXPIRED, "Token has expired");
    }

    public static ProblemException tokenInvalid() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, TOKEN_INVALID, "Token is invalid");
    }

    public static ProblemException sessionRevoked() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, SESSION_REVOKED, "Session has been revoked");
    }

    public static ProblemException otpExpired() {
        return new ProblemException(HttpStatus.BAD_REQUEST, OTP_EXPIRED, "Verification code has expired");
    }

    public static ProblemException otpInvalid() {
        return new ProblemException(HttpStatus.BAD_REQUEST, OTP_INVALID, "Verification code is invalid");
    }

    public static RetryableProblemException rateLimited(Duration retryAfter) {
        return new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, RATE_LIMITED,
                "Rate limit exceeded", roundUpSeconds(retryAfter));
    }

    public static ProblemException permissionDenied() {
        return new ProblemException(HttpStatus.FORBIDDEN, PERMISSION_DENIED, "Permission denied");
    }

    public static PolicyViolationException passwordPolicyViolation(List<String> violations) {
        return new PolicyViolationException(PASSWORD_POLICY_VIOLATION,
                "Password does not meet the password policy", violations);
    }

    public static ProblemException resetTokenInvalid() {
        return new ProblemException(HttpStatus.BAD_REQUEST, RESET_TOKEN_INVALID, "Reset token is invalid or expired");
    }

    public static ProblemException backendUnavailable(Throwable cause) {
        return new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, SECURITY_BACKEND_UNAVAILABLE,
                "Security backend temporarily unavailable", cause);
    }

    public static ProblemException notFound(String code) {
        return new ProblemException(HttpStatus.NOT_FOUND, code);
    }

    static long roundUpSeconds(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return 1L;
        }
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : seconds;
    }
}

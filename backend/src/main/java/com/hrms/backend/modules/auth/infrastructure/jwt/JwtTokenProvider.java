package com.hrms.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.modules.auth.domain.TokenType;

import org.springframework.stereotype.Component;

/**
 * Holds the two HMAC keys. Access and refresh tokens are signed with different keys so that
 * neither can be forged from the other.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final String BASE64_PREFIX = "base64:";

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtTokenProvider(SecurityProperties properties) {
        byte[] accessBytes = decode(properties.getJwt().getAccessSecret(), "access");
        byte[] refreshBytes = decode(properties.getJwt().getRefreshSecret(), "refresh");
        if (MessageDigest.isEqual(accessBytes, refreshBytes)) {
            throw new IllegalStateException("Access and refresh signing secrets must differ");
        }
        this.accessKey = new SecretKeySpec(accessBytes, HMAC_SHA_256);
        this.refreshKey = new SecretKeySpec(refreshBytes, HMAC_SHA_256);
    }

    public SecretKey keyFor(TokenType type) {
        return type == TokenType.ACCESS ? accessKey : refreshKey;
    }

    private static byte[] decode(String secret, String name) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Missing " + name + " token signing secret");
        }
        if (secret.startsWith(BASE64_PREFIX)) {
            return Base64.getDecoder().decode(secret.substring(BASE64_PREFIX.length()));
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}

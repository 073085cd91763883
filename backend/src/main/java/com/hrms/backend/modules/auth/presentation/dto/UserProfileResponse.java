package com.hrms.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hrms.backend.modules.auth.application.PermissionSet;
import com.hrms.backend.modules.auth.domain.UserAccount;

public record UserProfileResponse(
        UUID userId,
        String email,
        String fullName,
        String status,
        boolean twoFactorEnabled,
        OffsetDateTime emailVerifiedAt,
        OffsetDateTime lastLoginAt,
        List<String> roles,
        List<String> permissions
) {

    public static UserProfileResponse of(UserAccount user, PermissionSet permissions) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.getStatus().name(),
                user.isTwoFactorEnabled(),
                user.getEmailVerifiedAt(),
                user.getLastLoginAt(),
                permissions.roles(),
                permissions.permissions()
        );
    }
}

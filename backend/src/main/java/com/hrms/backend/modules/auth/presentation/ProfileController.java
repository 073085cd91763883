package com.hrms.backend.modules.auth.presentation;

import com.hrms.backend.global.security.AuthenticatedIdentity;
import com.hrms.backend.global.security.SecurityUtils;
import com.hrms.backend.modules.auth.application.AuthService;
import com.hrms.backend.modules.auth.application.PermissionResolver;
import com.hrms.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profile")
public class ProfileController {

    private final AuthService authService;
    private final PermissionResolver permissionResolver;

    public ProfileController(AuthService authService, PermissionResolver permissionResolver) {
        this.authService = authService;
        this.permissionResolver = permissionResolver;
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        AuthenticatedIdentity identity = SecurityUtils.currentIdentity();
        return ResponseEntity.ok(UserProfileResponse.of(
                authService.loadActiveUser(identity.userId()),
                permissionResolver.resolve(identity.userId())));
    }
}

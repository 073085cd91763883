package com.hrms.backend.modules.auth.presentation;

import com.hrms.backend.global.security.SecurityUtils;
import com.hrms.backend.modules.auth.application.PasswordService;
import com.hrms.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.hrms.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.hrms.backend.modules.auth.presentation.dto.MessageResponse;
import com.hrms.backend.modules.auth.presentation.dto.ResetPasswordRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/password")
public class PasswordController {

    private final PasswordService passwordService;

    public PasswordController(PasswordService passwordService) {
        this.passwordService = passwordService;
    }

    @PostMapping("/forgot")
    public ResponseEntity<MessageResponse> forgot(@Valid @RequestBody ForgotPasswordRequest request) {
        passwordService.requestReset(request.email());
        return ResponseEntity.accepted()
                .body(new MessageResponse("If the account exists, a password reset link has been sent"));
    }

    @PostMapping("/reset")
    public ResponseEntity<MessageResponse> reset(@Valid @RequestBody ResetPasswordRequest request) {
        passwordService.resetPassword(request.token(), request.newPassword());
        return ResponseEntity.ok(new MessageResponse("Password has been reset"));
    }

    @PostMapping("/change")
    public ResponseEntity<MessageResponse> change(@Valid @RequestBody ChangePasswordRequest request) {
        passwordService.changePassword(SecurityUtils.currentUserId(), request.currentPassword(), request.newPassword());
        return ResponseEntity.ok(new MessageResponse("Password changed, please sign in again"));
    }
}

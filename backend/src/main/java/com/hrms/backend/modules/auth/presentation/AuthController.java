package com.hrms.backend.modules.auth.presentation;

import com.hrms.backend.global.security.AuthenticatedIdentity;
import com.hrms.backend.global.security.SecurityUtils;
import com.hrms.backend.global.web.ClientIpResolver;
import com.hrms.backend.modules.auth.application.AuthService;
import com.hrms.backend.modules.auth.application.VerificationService;
import com.hrms.backend.modules.auth.presentation.dto.LoginRequest;
import com.hrms.backend.modules.auth.presentation.dto.LoginResponse;
import com.hrms.backend.modules.auth.presentation.dto.MessageResponse;
import com.hrms.backend.modules.auth.presentation.dto.OtpSendRequest;
import com.hrms.backend.modules.auth.presentation.dto.OtpSentResponse;
import com.hrms.backend.modules.auth.presentation.dto.OtpVerifyRequest;
import com.hrms.backend.modules.auth.presentation.dto.RefreshRequest;
import com.hrms.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.hrms.backend.modules.auth.presentation.dto.TwoFactorVerifyRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;
    private final VerificationService verificationService;
    private final ClientIpResolver clientIpResolver;

    public AuthController(
            AuthService authService,
            VerificationService verificationService,
            ClientIpResolver clientIpResolver
    ) {
        this.authService = authService;
        this.verificationService = verificationService;
        this.clientIpResolver = clientIpResolver;
    }

    @Operation(summary = "Password login", description = "Returns a token pair, or a two-factor challenge when the account requires one.")
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(LoginResponse.from(
                authService.login(request.email(), request.password(), clientIpResolver.contextOf(httpRequest))));
    }

    @Operation(summary = "Complete a two-factor login")
    @PostMapping("/auth/2fa/verify")
    public ResponseEntity<LoginResponse> verifyTwoFactor(@Valid @RequestBody TwoFactorVerifyRequest request,
                                                         HttpServletRequest httpRequest) {
        return ResponseEntity.ok(LoginResponse.from(
                authService.verifyTwoFactor(request.email(), request.code(), clientIpResolver.contextOf(httpRequest))));
    }

    @Operation(summary = "Rotate a refresh token", description = "The presented refresh token is revoked and cannot be used again.")
    @PostMapping("/auth/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(TokenPairResponse.from(
                authService.refresh(request.refreshToken(), clientIpResolver.contextOf(httpRequest)).tokens()));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout() {
        AuthenticatedIdentity identity = SecurityUtils.currentIdentity();
        authService.logout(identity.userId(), identity.sessionId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Send a verification code", description = "Responds identically whether or not the account exists.")
    @PostMapping("/auth/otp/send")
    public ResponseEntity<OtpSentResponse> sendOtp(@Valid @RequestBody OtpSendRequest request) {
        return ResponseEntity.accepted().body(new OtpSentResponse(
                "If the account exists, a verification code has been sent",
                verificationService.sendCode(request.email(), request.purpose())));
    }

    @PostMapping("/auth/otp/verify")
    public ResponseEntity<MessageResponse> verifyOtp(@Valid @RequestBody OtpVerifyRequest request) {
        verificationService.verifyCode(request.email(), request.purpose(), request.code());
        return ResponseEntity.ok(new MessageResponse("Verification successful"));
    }
}

package com.hrms.backend.modules.auth.presentation;

import java.util.UUID;

import com.hrms.backend.global.security.RequirePermission;
import com.hrms.backend.global.security.SecurityUtils;
import com.hrms.backend.modules.auth.application.AccessAdministrationService;
import com.hrms.backend.modules.auth.presentation.dto.PermissionGrantRequest;
import com.hrms.backend.modules.auth.presentation.dto.RoleAssignmentRequest;
import com.hrms.backend.modules.auth.presentation.dto.SessionRevocationResponse;
import com.hrms.backend.modules.auth.presentation.dto.UnlockRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminSecurityController {

    private final AccessAdministrationService administrationService;

    public AdminSecurityController(AccessAdministrationService administrationService) {
        this.administrationService = administrationService;
    }

    @Operation(summary = "Assign a role", description = "Evicts the user's cached permissions.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Assigned"),
            @ApiResponse(responseCode = "403", description = "roles.assign required"),
            @ApiResponse(responseCode = "404", description = "Unknown user or role")
    })
    @RequirePermission("roles.assign")
    @PostMapping("/users/{userId}/roles")
    public ResponseEntity<Void> assignRole(@PathVariable UUID userId, @Valid @RequestBody RoleAssignmentRequest request) {
        administrationService.assignRole(userId, request.role(), SecurityUtils.currentUserId());
        return ResponseEntity.noContent().build();
    }

    @RequirePermission("roles.assign")
    @DeleteMapping("/users/{userId}/roles/{roleSlug}")
    public ResponseEntity<Void> revokeRole(@PathVariable UUID userId, @PathVariable String roleSlug) {
        administrationService.revokeRole(userId, roleSlug, SecurityUtils.currentUserId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Grant a permission to a role", description = "Evicts cached permissions of every holder of the role.")
    @RequirePermission("roles.update")
    @PostMapping("/roles/{roleSlug}/permissions")
    public ResponseEntity<Void> grantPermission(@PathVariable String roleSlug,
                                                @Valid @RequestBody PermissionGrantRequest request) {
        administrationService.grantPermission(roleSlug, request.permission());
        return ResponseEntity.noContent().build();
    }

    @RequirePermission("roles.update")
    @DeleteMapping("/roles/{roleSlug}/permissions/{permissionSlug}")
    public ResponseEntity<Void> revokePermission(@PathVariable String roleSlug, @PathVariable String permissionSlug) {
        administrationService.revokePermission(roleSlug, permissionSlug);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Revoke every live session of a user")
    @RequirePermission("sessions.revoke")
    @PostMapping("/users/{userId}/sessions/revoke")
    public ResponseEntity<SessionRevocationResponse> revokeSessions(@PathVariable UUID userId) {
        return ResponseEntity.ok(new SessionRevocationResponse(userId, administrationService.revokeAllSessions(userId)));
    }

    @RequirePermission("users.unlock")
    @PostMapping("/lockouts/unlock")
    public ResponseEntity<Void> unlock(@Valid @RequestBody UnlockRequest request) {
        administrationService.unlock(request.scope(), request.identifier());
        return ResponseEntity.noContent().build();
    }
}

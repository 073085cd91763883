package com.hrms.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hrms.backend.global.error.ProblemException;
import com.hrms.backend.modules.auth.application.LoginAttemptGovernor.AttemptScope;
import com.hrms.backend.modules.auth.domain.Permission;
import com.hrms.backend.modules.auth.domain.Role;
import com.hrms.backend.modules.auth.domain.UserAccount;
import com.hrms.backend.modules.auth.domain.UserRole;
import com.hrms.backend.modules.auth.infrastructure.persistence.CredentialStore;
import com.hrms.backend.modules.auth.infrastructure.persistence.PermissionRepository;
import com.hrms.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.hrms.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.hrms.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative changes to grants, sessions and lockouts. Every grant change evicts the
 * permission cache of each affected user inside the same operation.
 */
@Service
public class AccessAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(AccessAdministrationService.class);
    static final String REASON_ADMIN_REVOKE = "ADMIN_REVOKE";

    private final UserAccountRepository userAccountRepository;
    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final UserRoleRepository userRoleRepository;
    private final PermissionResolver permissionResolver;
    private final SessionRegistry sessionRegistry;
    private final LoginAttemptGovernor attemptGovernor;
    private final CredentialStore credentialStore;
    private final Clock clock;

    public AccessAdministrationService(
            UserAccountRepository userAccountRepository,
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            UserRoleRepository userRoleRepository,
            PermissionResolver permissionResolver,
            SessionRegistry sessionRegistry,
            LoginAttemptGovernor attemptGovernor,
            CredentialStore credentialStore,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.userRoleRepository = userRoleRepository;
        this.permissionResolver = permissionResolver;
        this.sessionRegistry = sessionRegistry;
        this.attemptGovernor = attemptGovernor;
        this.credentialStore = credentialStore;
        this.clock = clock;
    }

    @Transactional
    public void assignRole(UUID userId, String roleSlug, UUID actorId) {
        UserAccount user = userAccountRepository.findActiveById(userId)
                .orElseThrow(() -> AuthProblems.notFound("USER_NOT_FOUND"));
        Role role = roleRepository.findBySlug(roleSlug)
                .orElseThrow(() -> AuthProblems.notFound("ROLE_NOT_FOUND"));
        if (userRoleRepository.findActiveGrant(userId, roleSlug).isPresent()) {
            return;
        }
        UserRole grant = new UserRole();
        grant.setUser(user);
        grant.setRole(role);
        grant.setGrantedAt(OffsetDateTime.now(clock));
        grant.setGrantedBy(actorId);
        userRoleRepository.save(grant);
        permissionResolver.evictNowAndAfterCommit(userId);
        log.info("Assigned role {} to user {} by {}", roleSlug, userId, actorId);
    }

    @Transactional
    public void revokeRole(UUID userId, String roleSlug, UUID actorId) {
        UserRole grant = userRoleRepository.findActiveGrant(userId, roleSlug)
                .orElseThrow(() -> AuthProblems.notFound("ROLE_ASSIGNMENT_NOT_FOUND"));
        grant.setRevokedAt(OffsetDateTime.now(clock));
        permissionResolver.evictNowAndAfterCommit(userId);
        log.info("Revoked role {} from user {} by {}", roleSlug, userId, actorId);
    }

    @Transactional
    public void grantPermission(String roleSlug, String permissionSlug) {
        Role role = roleRepository.findBySlugWithPermissions(roleSlug)
                .orElseThrow(() -> AuthProblems.notFound("ROLE_NOT_FOUND"));
        Permission permission = permissionRepository.findBySlug(permissionSlug)
                .orElseThrow(() -> AuthProblems.notFound("PERMISSION_NOT_FOUND"));
        if (role.getPermissions().add(permission)) {
            evictRoleHolders(role);
            log.info("Granted permission {} to role {}", permissionSlug, roleSlug);
        }
    }

    @Transactional
    public void revokePermission(String roleSlug, String permissionSlug) {
        Role role = roleRepository.findBySlugWithPermissions(roleSlug)
                .orElseThrow(() -> AuthProblems.notFound("ROLE_NOT_FOUND"));
        boolean removed = role.getPermissions().removeIf(permission -> permission.getSlug().equals(permissionSlug));
        if (!removed) {
            throw AuthProblems.notFound("PERMISSION_NOT_GRANTED");
        }
        evictRoleHolders(role);
        log.info("Revoked permission {} from role {}", permissionSlug, roleSlug);
    }

    @Transactional
    public int revokeAllSessions(UUID userId) {
        userAccountRepository.findById(userId)
                .orElseThrow(() -> AuthProblems.notFound("USER_NOT_FOUND"));
        int revoked = sessionRegistry.revokeAllForUser(userId, REASON_ADMIN_REVOKE);
        permissionResolver.evict(userId);
        return revoked;
    }

    @Transactional
    public void unlock(AttemptScope scope, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "IDENTIFIER_REQUIRED");
        }
        attemptGovernor.clear(scope, identifier);
        if (scope == AttemptScope.ACCOUNT) {
            credentialStore.clearFailedLogins(identifier);
        }
        log.info("Cleared {} lockout for {}", scope, identifier);
    }

    private void evictRoleHolders(Role role) {
        List<UUID> holders = userRoleRepository.findActiveUserIdsByRole(role.getId());
        holders.forEach(permissionResolver::evictNowAndAfterCommit);
    }
}

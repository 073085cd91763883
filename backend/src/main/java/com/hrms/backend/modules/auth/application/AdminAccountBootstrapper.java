package com.hrms.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.hrms.backend.modules.auth.domain.Role;
import com.hrms.backend.modules.auth.domain.UserAccount;
import com.hrms.backend.modules.auth.domain.UserRole;
import com.hrms.backend.modules.auth.domain.UserStatus;
import com.hrms.backend.modules.auth.infrastructure.persistence.CredentialStore;
import com.hrms.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.hrms.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.hrms.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates the first administrator from {@code app.bootstrap.admin-email} and
 * {@code app.bootstrap.admin-password} when both are set and the account does not exist yet.
 */
@Component
public class AdminAccountBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountBootstrapper.class);
    static final String ADMIN_ROLE = "super_admin";

    private final UserAccountRepository userAccountRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final PasswordPolicy passwordPolicy;
    private final PasswordHasher passwordHasher;
    private final Clock clock;
    private final String adminEmail;
    private final String adminPassword;

    public AdminAccountBootstrapper(
            UserAccountRepository userAccountRepository,
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            PasswordPolicy passwordPolicy,
            PasswordHasher passwordHasher,
            Clock clock,
            @Value("${app.bootstrap.admin-email:}") String adminEmail,
            @Value("${app.bootstrap.admin-password:}") String adminPassword
    ) {
        this.userAccountRepository = userAccountRepository;
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.passwordPolicy = passwordPolicy;
        this.passwordHasher = passwordHasher;
        this.clock = clock;
        this.adminEmail = adminEmail;
        this.adminPassword = adminPassword;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(adminEmail) || !StringUtils.hasText(adminPassword)) {
            return;
        }
        String email = CredentialStore.normalizeEmail(adminEmail);
        if (userAccountRepository.findActiveByEmail(email).isPresent()) {
            return;
        }
        passwordPolicy.enforce(adminPassword);
        Role role = roleRepository.findBySlug(ADMIN_ROLE)
                .orElseThrow(() -> new IllegalStateException("Seed role " + ADMIN_ROLE + " is missing"));

        OffsetDateTime now = OffsetDateTime.now(clock);
        UserAccount admin = new UserAccount();
        admin.setEmail(email);
        admin.setFullName("Administrator");
        admin.setPasswordHash(passwordHasher.hash(adminPassword));
        admin.setStatus(UserStatus.ACTIVE);
        admin.setEmailVerifiedAt(now);
        admin.setPasswordChangedAt(now);
        userAccountRepository.save(admin);

        UserRole grant = new UserRole();
        grant.setUser(admin);
        grant.setRole(role);
        grant.setGrantedAt(now);
        userRoleRepository.save(grant);
        log.info("Bootstrapped administrator account {}", email);
    }
}

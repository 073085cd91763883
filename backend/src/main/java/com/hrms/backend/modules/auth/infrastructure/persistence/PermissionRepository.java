package com.hrms.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.hrms.backend.modules.auth.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findBySlug(String slug);
}

package com.hrms.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.hrms.backend.modules.auth.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    @Query("select r from Role r left join fetch r.permissions where r.slug = :slug")
    Optional<Role> findBySlugWithPermissions(@Param("slug") String slug);

    Optional<Role> findBySlug(String slug);
}

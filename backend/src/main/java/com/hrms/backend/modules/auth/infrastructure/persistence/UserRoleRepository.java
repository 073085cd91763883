package com.hrms.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hrms.backend.modules.auth.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleRepository extends JpaRepository<UserRole, UUID> {

    @Query("""
            select distinct r.slug
              from UserRole ur
              join ur.role r
             where ur.user.id = :userId
               and ur.revokedAt is null
            """)
    List<String> findActiveRoleSlugs(@Param("userId") UUID userId);

    @Query("""
            select distinct p.slug
              from UserRole ur
              join ur.role r
              join r.permissions p
             where ur.user.id = :userId
               and ur.revokedAt is null
            """)
    List<String> findActivePermissionSlugs(@Param("userId") UUID userId);

    @Query("""
            select ur
              from UserRole ur
              join fetch ur.role r
             where ur.user.id = :userId
               and r.slug = :roleSlug
               and ur.revokedAt is null
            """)
    Optional<UserRole> findActiveGrant(@Param("userId") UUID userId, @Param("roleSlug") String roleSlug);

    @Query("""
            select distinct ur.user.id
              from UserRole ur
             where ur.role.id = :roleId
               and ur.revokedAt is null
            """)
    List<UUID> findActiveUserIdsByRole(@Param("roleId") UUID roleId);
}

package com.hrms.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.hrms.backend.modules.auth.domain.UserAccount;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    @Query("select u from UserAccount u where lower(u.email) = lower(:email) and u.deletedAt is null")
    Optional<UserAccount> findActiveByEmail(@Param("email") String email);

    @Query("select u from UserAccount u where u.id = :id and u.deletedAt is null")
    Optional<UserAccount> findActiveById(@Param("id") UUID id);

    @Modifying
    @Query("""
            update UserAccount u
               set u.lastLoginAt = :loginAt,
                   u.lastLoginIp = :ip,
                   u.failedLoginAttempts = 0,
                   u.lockedUntil = null
             where u.id = :id
            """)
    int recordSuccessfulLogin(@Param("id") UUID id,
                              @Param("loginAt") OffsetDateTime loginAt,
                              @Param("ip") String ip);

    @Modifying
    @Query("""
            update UserAccount u
               set u.failedLoginAttempts = :attempts,
                   u.lockedUntil = :lockedUntil
             where lower(u.email) = lower(:email)
               and u.deletedAt is null
            """)
    int recordFailedLogin(@Param("email") String email,
                          @Param("attempts") int attempts,
                          @Param("lockedUntil") OffsetDateTime lockedUntil);

    @Modifying
    @Query("""
            update UserAccount u
               set u.failedLoginAttempts = 0,
                   u.lockedUntil = null
             where lower(u.email) = lower(:email)
            """)
    int clearFailedLogins(@Param("email") String email);
}

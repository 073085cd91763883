package com.hrms.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hrms.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt > :now
            """)
    List<UserSession> findActiveByUserId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.id = :sessionId
               and us.revokedAt is null
            """)
    int markRevoked(@Param("sessionId") UUID sessionId,
                    @Param("revokedAt") OffsetDateTime revokedAt,
                    @Param("reason") String reason);
}

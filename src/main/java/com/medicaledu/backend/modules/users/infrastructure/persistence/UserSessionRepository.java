package com.medicaledu.backend.modules.users.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.modules.users.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user
             where us.refreshToken = :refreshToken
            """)
    Optional<UserSession> findByRefreshToken(@Param("refreshToken") String refreshToken);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt <= :now
            """)
    int revokeExpiredSessions(@Param("userId") UUID userId,
                              @Param("now") OffsetDateTime now,
                              @Param("reason") String reason);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
            """)
    int revokeAllActiveSessions(@Param("userId") UUID userId,
                                @Param("now") OffsetDateTime now,
                                @Param("reason") String reason);

    @Modifying
    @Query("""
            delete from UserSession us
             where us.expiresAt < :threshold
                or us.revokedAt < :threshold
            """)
    int deleteStaleSessions(@Param("threshold") OffsetDateTime threshold);
}

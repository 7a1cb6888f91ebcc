package com.hronboard.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user u
             where u.id = :userId
               and us.tokenHash = :tokenHash
               and us.active = true
               and us.expiresAt > :now
               and u.active = true
            """)
    Optional<UserSession> findValidSession(@Param("userId") UUID userId,
                                           @Param("tokenHash") String tokenHash,
                                           @Param("now") OffsetDateTime now);

    @Query("""
            select us
              from UserSession us
             where us.user.id = :userId
               and us.active = true
               and us.expiresAt > :now
             order by us.createdAt desc
            """)
    List<UserSession> findActiveSessions(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("update UserSession us set us.active = false where us.id = :sessionId")
    int deactivate(@Param("sessionId") UUID sessionId);

    @Modifying
    @Query("update UserSession us set us.active = false where us.user.id = :userId and us.active = true")
    int deactivateAllForUser(@Param("userId") UUID userId);

    @Modifying
    @Query("""
            update UserSession us
               set us.active = false
             where us.user.id = :userId
               and us.active = true
               and us.id <> :keepSessionId
            """)
    int deactivateOthersForUser(@Param("userId") UUID userId, @Param("keepSessionId") UUID keepSessionId);
}

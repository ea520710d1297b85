package com.amumal.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.amumal.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, Long> {

    Optional<UserSession> findBySessionHash(String sessionHash);

    @Modifying
    @Query("delete from UserSession us where us.sessionHash = :sessionHash")
    int deleteBySessionHash(@Param("sessionHash") String sessionHash);

    @Modifying
    @Query("delete from UserSession us where us.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);

    @Modifying
    @Query("delete from UserSession us where us.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}

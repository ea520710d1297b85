package com.amumal.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.amumal.backend.modules.auth.domain.RotatedRefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RotatedRefreshTokenRepository extends JpaRepository<RotatedRefreshToken, String> {

    @Modifying
    @Query("delete from RotatedRefreshToken rrt where rrt.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);

    @Modifying
    @Query("delete from RotatedRefreshToken rrt where rrt.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}

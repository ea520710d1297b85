package com.amumal.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 회전으로 폐기된 갱신 비밀값의 흔적. 회전 이후 같은 값이 다시 제시되면 재사용으로 판정한다.
 */
@Entity
@Table(name = "rotated_refresh_token")
public class RotatedRefreshToken {

    @Id
    @Column(name = "token_hash", nullable = false, updatable = false, length = 64)
    private String tokenHash;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "rotated_at", nullable = false, updatable = false)
    private OffsetDateTime rotatedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    protected RotatedRefreshToken() {
    }

    public RotatedRefreshToken(String tokenHash, Long userId, OffsetDateTime rotatedAt, OffsetDateTime expiresAt) {
        this.tokenHash = tokenHash;
        this.userId = userId;
        this.rotatedAt = rotatedAt;
        this.expiresAt = expiresAt;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public Long getUserId() {
        return userId;
    }

    public OffsetDateTime getRotatedAt() {
        return rotatedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }
}

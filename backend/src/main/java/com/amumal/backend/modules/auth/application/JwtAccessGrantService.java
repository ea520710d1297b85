package com.amumal.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;

import javax.crypto.SecretKey;

import com.amumal.backend.global.config.AuthProperties;
import com.amumal.backend.global.transaction.TransactionScope;
import com.amumal.backend.modules.auth.domain.AuthFailureReason;
import com.amumal.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * 무상태 access grant. 서명과 만료만 검사하며 저장소를 조회하지 않는다.
 * payload에는 계정 id(sub)와 발급/만료 시각, type=access만 담는다.
 */
@Service
@ConditionalOnProperty(prefix = "app.auth", name = "access-mode", havingValue = "stateless", matchIfMissing = true)
public class JwtAccessGrantService implements CredentialValidator, AccessGrantMinter {

    static final String TYPE_CLAIM = "type";
    static final String ACCESS_TYPE = "access";

    private final SecretKey secretKey;
    private final long accessTtlSeconds;
    private final Clock clock;

    public JwtAccessGrantService(JwtTokenProvider tokenProvider, AuthProperties authProperties, Clock clock) {
        this.secretKey = tokenProvider.getSecretKey();
        this.accessTtlSeconds = authProperties.accessTtl().toSeconds();
        this.clock = clock;
    }

    @Override
    public AccessGrant mint(TransactionScope scope, long userId) {
        Instant now = clock.instant();
        Instant expiry = now.plusSeconds(accessTtlSeconds);

        String token = Jwts.builder()
                .subject(Long.toString(userId))
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(TYPE_CLAIM, ACCESS_TYPE)
                .signWith(secretKey, SIG.HS256)
                .compact();

        return new AccessGrant(token, OffsetDateTime.ofInstant(expiry, clock.getZone()), accessTtlSeconds);
    }

    @Override
    public long validate(String accessGrant) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(accessGrant)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new CredentialRejectedException(AuthFailureReason.EXPIRED, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new CredentialRejectedException(AuthFailureReason.MALFORMED, e);
        }

        if (!ACCESS_TYPE.equals(claims.get(TYPE_CLAIM, String.class))) {
            throw new CredentialRejectedException(AuthFailureReason.MALFORMED);
        }
        try {
            return Long.parseLong(claims.getSubject());
        } catch (NumberFormatException e) {
            throw new CredentialRejectedException(AuthFailureReason.MALFORMED, e);
        }
    }

    @Override
    public void revoke(TransactionScope scope, String accessGrant) {
        // 무상태 grant는 만료될 때까지 유효하다.
    }

    @Override
    public void revokeAll(TransactionScope scope, long userId) {
        // 무상태 grant는 만료될 때까지 유효하다.
    }
}

package com.amumal.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.amumal.backend.modules.auth.application.AccessGrant;

public record AccessTokenResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime expiresAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static AccessTokenResponse from(AccessGrant grant) {
        return new AccessTokenResponse(grant.value(), DEFAULT_TOKEN_TYPE, grant.expiresInSeconds(), grant.expiresAt());
    }
}

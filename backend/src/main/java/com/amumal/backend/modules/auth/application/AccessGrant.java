package com.amumal.backend.modules.auth.application;

import java.time.OffsetDateTime;

public record AccessGrant(String value, OffsetDateTime expiresAt, long expiresInSeconds) {
}

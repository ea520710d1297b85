package com.amumal.backend.modules.auth.application;

import java.time.OffsetDateTime;

/**
 * 발급 또는 회전 결과. renewalSecret 원문은 쿠키로 한 번 내려간 뒤 서버에 남지 않는다.
 */
public record IssuedCredentials(
        long userId,
        AccessGrant accessGrant,
        String renewalSecret,
        OffsetDateTime renewalExpiresAt
) {
}

package com.amumal.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Map;

import com.amumal.backend.modules.auth.domain.UserAccountColumn;

public interface UserAccountRepositoryCustom {

    /**
     * 허용 목록 컬럼만 갱신한다. 활성 계정만 대상이며 갱신된 행 수를 반환한다.
     */
    int updateColumns(long id, Map<UserAccountColumn, ?> values, OffsetDateTime updatedAt);

    /**
     * 저장된 비밀번호 해시가 expectedPasswordHash와 같을 때만 갱신한다.
     * 확인 이후 다른 요청이 비밀번호를 바꿨다면 0을 반환한다.
     */
    int updateColumnsIfPasswordHash(long id, Map<UserAccountColumn, ?> values, String expectedPasswordHash,
                                    OffsetDateTime updatedAt);

    int markWithdrawn(long id, String anonymizedEmail, String anonymizedNickname, String passwordMarker,
                      OffsetDateTime deletedAt);
}

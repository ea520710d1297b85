package com.amumal.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.stereotype.Repository;

import com.amumal.backend.modules.auth.domain.UserAccountColumn;

@Repository
public class UserAccountRepositoryImpl implements UserAccountRepositoryCustom {

    private static final String ID_PARAM = "id";
    private static final String UPDATED_AT_PARAM = "updatedAt";
    private static final String EXPECTED_HASH_PARAM = "expectedPasswordHash";

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public int updateColumns(long id, Map<UserAccountColumn, ?> values, OffsetDateTime updatedAt) {
        return executeUpdate(id, values, null, updatedAt);
    }

    @Override
    public int updateColumnsIfPasswordHash(long id, Map<UserAccountColumn, ?> values, String expectedPasswordHash,
                                           OffsetDateTime updatedAt) {
        Objects.requireNonNull(expectedPasswordHash, "expectedPasswordHash must not be null");
        return executeUpdate(id, values, expectedPasswordHash, updatedAt);
    }

    private int executeUpdate(long id, Map<UserAccountColumn, ?> values, String expectedPasswordHash,
                              OffsetDateTime updatedAt) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("At least one column must be provided");
        }

        // 컬럼 식별자는 enum 상수에서만 가져오고, 값은 모두 바인딩 파라미터로 전달한다.
        Map<UserAccountColumn, Object> ordered = new EnumMap<>(UserAccountColumn.class);
        ordered.putAll(values);
        StringJoiner assignments = new StringJoiner(", ");
        Map<String, Object> params = new HashMap<>();
        for (Map.Entry<UserAccountColumn, Object> entry : ordered.entrySet()) {
            String column = entry.getKey().columnName();
            if (entry.getValue() == null) {
                assignments.add(column + " = NULL");
                continue;
            }
            String param = "v_" + entry.getKey().name().toLowerCase(Locale.ROOT);
            assignments.add(column + " = :" + param);
            params.put(param, entry.getValue());
        }
        assignments.add("updated_at = :" + UPDATED_AT_PARAM);
        params.put(UPDATED_AT_PARAM, updatedAt);
        params.put(ID_PARAM, id);

        String sql = "UPDATE user_account SET " + assignments
                + " WHERE id = :" + ID_PARAM + " AND deleted_at IS NULL";
        if (expectedPasswordHash != null) {
            sql += " AND " + UserAccountColumn.PASSWORD_HASH.columnName() + " = :" + EXPECTED_HASH_PARAM;
            params.put(EXPECTED_HASH_PARAM, expectedPasswordHash);
        }

        entityManager.flush();
        Query query = entityManager.createNativeQuery(sql);
        params.forEach(query::setParameter);
        return query.executeUpdate();
    }

    @Override
    public int markWithdrawn(long id, String anonymizedEmail, String anonymizedNickname, String passwordMarker,
                             OffsetDateTime deletedAt) {
        entityManager.flush();
        return entityManager.createNativeQuery("""
                        UPDATE user_account
                           SET deleted_at = :deletedAt,
                               email = :email,
                               nickname = :nickname,
                               password_hash = :passwordHash,
                               profile_image_url = NULL,
                               updated_at = :deletedAt
                         WHERE id = :id
                           AND deleted_at IS NULL
                        """)
                .setParameter("deletedAt", deletedAt)
                .setParameter("email", anonymizedEmail)
                .setParameter("nickname", anonymizedNickname)
                .setParameter("passwordHash", passwordMarker)
                .setParameter(ID_PARAM, id)
                .executeUpdate();
    }
}

package com.amumal.backend.modules.auth.domain;

/**
 * 부분 갱신이 허용된 user_account 컬럼 목록.
 * SQL 컬럼 식별자는 이 상수들에서만 만들어진다.
 */
public enum UserAccountColumn {
    EMAIL("email"),
    NICKNAME("nickname"),
    PROFILE_IMAGE_URL("profile_image_url"),
    PASSWORD_HASH("password_hash");

    private final String columnName;

    UserAccountColumn(String columnName) {
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }
}

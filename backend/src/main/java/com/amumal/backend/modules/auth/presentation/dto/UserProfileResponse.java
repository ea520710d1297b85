package com.amumal.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.amumal.backend.modules.auth.domain.UserAccount;

public record UserProfileResponse(
        long id,
        String email,
        String nickname,
        String profileImageUrl,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static UserProfileResponse from(UserAccount account) {
        return new UserProfileResponse(
                account.getId(),
                account.getEmail(),
                account.getNickname(),
                account.getProfileImageUrl(),
                account.getCreatedAt(),
                account.getUpdatedAt()
        );
    }
}

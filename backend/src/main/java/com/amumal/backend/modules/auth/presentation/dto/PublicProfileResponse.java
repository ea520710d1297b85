package com.amumal.backend.modules.auth.presentation.dto;

import com.amumal.backend.modules.auth.domain.UserAccount;

public record PublicProfileResponse(
        long id,
        String nickname,
        String profileImageUrl
) {
    public static PublicProfileResponse from(UserAccount account) {
        return new PublicProfileResponse(account.getId(), account.getNickname(), account.getProfileImageUrl());
    }
}

package com.amumal.backend.modules.auth.application;

import com.amumal.backend.modules.auth.presentation.dto.UserProfileResponse;

public record AuthenticatedSession(IssuedCredentials credentials, UserProfileResponse user) {
}

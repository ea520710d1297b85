package com.amumal.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ChangePasswordRequest(
        @NotBlank(message = "currentPassword is required") String currentPassword,
        @NotBlank(message = "newPassword is required") String newPassword,
        @NotBlank(message = "newPasswordConfirm is required") String newPasswordConfirm
) {
}

package com.amumal.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address")
        @Size(max = 255) String email,
        @NotBlank(message = "nickname is required")
        @Pattern(regexp = "^[a-zA-Z0-9_]{3,10}$", message = "nickname must be 3-10 letters, digits or underscores")
        String nickname,
        @NotBlank(message = "password is required") String password,
        @Size(max = 500) String profileImageUrl
) {
}

package com.amumal.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 부분 수정 요청. null인 필드는 변경하지 않는다.
 */
public record UpdateProfileRequest(
        @Email(message = "email must be a valid address") @Size(max = 255) String email,
        @Pattern(regexp = "^[a-zA-Z0-9_]{3,10}$", message = "nickname must be 3-10 letters, digits or underscores")
        String nickname,
        @Size(max = 500) String profileImageUrl
) {
}

package com.amumal.backend.modules.post.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePostRequest(
        @NotBlank(message = "title is required") @Size(max = 200) String title,
        @NotBlank(message = "content is required") @Size(max = 20000) String content
) {
}

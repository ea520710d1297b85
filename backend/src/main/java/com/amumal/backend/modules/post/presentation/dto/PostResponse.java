package com.amumal.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;

import com.amumal.backend.modules.post.domain.Post;

public record PostResponse(
        long id,
        Long authorId,
        String authorNickname,
        String title,
        String content,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static PostResponse from(Post post, String authorNickname) {
        return new PostResponse(
                post.getId(),
                post.getAuthorId(),
                authorNickname,
                post.getTitle(),
                post.getContent(),
                post.getCreatedAt(),
                post.getUpdatedAt()
        );
    }
}

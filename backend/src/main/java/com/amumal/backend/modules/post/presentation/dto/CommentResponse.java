package com.amumal.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;

import com.amumal.backend.modules.post.domain.Comment;

public record CommentResponse(
        long id,
        long postId,
        Long authorId,
        String authorNickname,
        String content,
        OffsetDateTime createdAt
) {
    public static CommentResponse from(Comment comment, String authorNickname) {
        return new CommentResponse(
                comment.getId(),
                comment.getPostId(),
                comment.getAuthorId(),
                authorNickname,
                comment.getContent(),
                comment.getCreatedAt()
        );
    }
}

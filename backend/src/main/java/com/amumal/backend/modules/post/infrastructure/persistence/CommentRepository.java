package com.amumal.backend.modules.post.infrastructure.persistence;

import java.util.Optional;

import com.amumal.backend.modules.post.domain.Comment;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CommentRepository extends JpaRepository<Comment, Long> {

    Optional<Comment> findByIdAndPostIdAndDeletedAtIsNull(Long id, Long postId);
}

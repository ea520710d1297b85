package com.amumal.backend.modules.post.infrastructure.persistence;

import java.util.Optional;

import com.amumal.backend.modules.post.domain.Post;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PostRepository extends JpaRepository<Post, Long> {

    Optional<Post> findByIdAndDeletedAtIsNull(Long id);

    boolean existsByIdAndDeletedAtIsNull(Long id);
}

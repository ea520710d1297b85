package com.amumal.backend.modules.post.presentation;

import java.net.URI;

import com.amumal.backend.global.security.SecurityUtils;
import com.amumal.backend.modules.post.application.PostService;
import com.amumal.backend.modules.post.presentation.dto.CommentResponse;
import com.amumal.backend.modules.post.presentation.dto.CreateCommentRequest;
import com.amumal.backend.modules.post.presentation.dto.CreatePostRequest;
import com.amumal.backend.modules.post.presentation.dto.PostResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/posts")
public class PostController {

    private final PostService postService;

    public PostController(PostService postService) {
        this.postService = postService;
    }

    @Operation(summary = "게시글 작성")
    @PostMapping
    public ResponseEntity<PostResponse> createPost(@Valid @RequestBody CreatePostRequest request) {
        PostResponse created = postService.createPost(SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.created(URI.create("/v1/posts/" + created.id())).body(created);
    }

    @GetMapping("/{postId}")
    public ResponseEntity<PostResponse> getPost(@PathVariable long postId) {
        return ResponseEntity.ok(postService.getPost(postId));
    }

    @Operation(summary = "댓글 작성")
    @PostMapping("/{postId}/comments")
    public ResponseEntity<CommentResponse> createComment(
            @PathVariable long postId,
            @Valid @RequestBody CreateCommentRequest request
    ) {
        CommentResponse created = postService.createComment(SecurityUtils.getCurrentUserId(), postId, request);
        return ResponseEntity.created(URI.create("/v1/posts/" + postId + "/comments/" + created.id())).body(created);
    }

    @GetMapping("/{postId}/comments/{commentId}")
    public ResponseEntity<CommentResponse> getComment(@PathVariable long postId, @PathVariable long commentId) {
        return ResponseEntity.ok(postService.getComment(postId, commentId));
    }
}

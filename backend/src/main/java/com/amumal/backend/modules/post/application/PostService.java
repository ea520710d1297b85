package com.amumal.backend.modules.post.application;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.global.transaction.TransactionScope;
import com.amumal.backend.global.transaction.TransactionalWriteCoordinator;
import com.amumal.backend.modules.auth.domain.UserAccount;
import com.amumal.backend.modules.auth.infrastructure.persistence.IdentityStore;
import com.amumal.backend.modules.post.domain.Comment;
import com.amumal.backend.modules.post.domain.Post;
import com.amumal.backend.modules.post.infrastructure.persistence.CommentRepository;
import com.amumal.backend.modules.post.infrastructure.persistence.PostRepository;
import com.amumal.backend.modules.post.presentation.dto.CommentResponse;
import com.amumal.backend.modules.post.presentation.dto.CreateCommentRequest;
import com.amumal.backend.modules.post.presentation.dto.CreatePostRequest;
import com.amumal.backend.modules.post.presentation.dto.PostResponse;

import org.springframework.stereotype.Service;

/**
 * 게시글/댓글 작성과 조회. 작성 결과는 같은 원자 단위 안에서 다시 읽어 응답한다.
 */
@Service
public class PostService {

    private final TransactionalWriteCoordinator coordinator;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final IdentityStore identityStore;

    public PostService(
            TransactionalWriteCoordinator coordinator,
            PostRepository postRepository,
            CommentRepository commentRepository,
            IdentityStore identityStore
    ) {
        this.coordinator = coordinator;
        this.postRepository = postRepository;
        this.commentRepository = commentRepository;
        this.identityStore = identityStore;
    }

    public PostResponse createPost(long authorId, CreatePostRequest request) {
        return coordinator.runAtomic(scope -> {
            UserAccount author = requireActiveAuthor(scope, authorId);
            scope.ensureWritable();
            Post saved = postRepository.saveAndFlush(new Post(authorId, request.title().trim(), request.content()));
            Post reloaded = postRepository.findByIdAndDeletedAtIsNull(saved.getId())
                    .orElseThrow(() -> new IllegalStateException("Inserted post is not visible in its own transaction"));
            return PostResponse.from(reloaded, author.getNickname());
        });
    }

    public PostResponse getPost(long postId) {
        return coordinator.read(scope -> {
            Post post = postRepository.findByIdAndDeletedAtIsNull(postId)
                    .orElseThrow(PostService::postNotFound);
            return PostResponse.from(post, nicknameOf(scope, post.getAuthorId()));
        });
    }

    public CommentResponse createComment(long authorId, long postId, CreateCommentRequest request) {
        return coordinator.runAtomic(scope -> {
            UserAccount author = requireActiveAuthor(scope, authorId);
            if (!postRepository.existsByIdAndDeletedAtIsNull(postId)) {
                throw postNotFound();
            }
            scope.ensureWritable();
            Comment saved = commentRepository.saveAndFlush(new Comment(postId, authorId, request.content()));
            Comment reloaded = commentRepository.findByIdAndPostIdAndDeletedAtIsNull(saved.getId(), postId)
                    .orElseThrow(() -> new IllegalStateException("Inserted comment is not visible in its own transaction"));
            return CommentResponse.from(reloaded, author.getNickname());
        });
    }

    public CommentResponse getComment(long postId, long commentId) {
        return coordinator.read(scope -> {
            Comment comment = commentRepository.findByIdAndPostIdAndDeletedAtIsNull(commentId, postId)
                    .orElseThrow(() -> new ProblemException(ErrorCategory.NOT_FOUND, "comment_not_found", "댓글을 찾을 수 없습니다."));
            return CommentResponse.from(comment, nicknameOf(scope, comment.getAuthorId()));
        });
    }

    private UserAccount requireActiveAuthor(TransactionScope scope, long authorId) {
        return identityStore.findActiveById(scope, authorId)
                .orElseThrow(ProblemException::unauthenticated);
    }

    // 탈퇴한 작성자는 익명화된 닉네임으로 표시된다.
    private String nicknameOf(TransactionScope scope, Long authorId) {
        if (authorId == null) {
            return null;
        }
        return identityStore.findById(scope, authorId)
                .map(UserAccount::getNickname)
                .orElse(null);
    }

    private static ProblemException postNotFound() {
        return new ProblemException(ErrorCategory.NOT_FOUND, "post_not_found", "게시글을 찾을 수 없습니다.");
    }
}

package com.graphqldemo.post.service;

import com.graphqldemo.auth.exception.BusinessException;
import com.graphqldemo.auth.exception.ErrorCode;
import com.graphqldemo.auth.exception.ValidationException;
import com.graphqldemo.auth.security.AuthenticatedUser;
import com.graphqldemo.auth.security.Role;
import com.graphqldemo.cache.UserPostsCache;
import com.graphqldemo.common.page.PageResult;
import com.graphqldemo.common.page.SortDirection;
import com.graphqldemo.post.model.Post;
import com.graphqldemo.post.model.PostFilter;
import com.graphqldemo.post.model.PostOrder;
import com.graphqldemo.user.domain.User;
import com.graphqldemo.user.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = "/cleanup.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class PostServiceImplTest {

    @Autowired
    private PostService postService;
    @Autowired
    private UserService userService;
    @SpyBean
    private UserPostsCache userPostsCache;

    private AuthenticatedUser owner;
    private AuthenticatedUser stranger;

    @BeforeEach
    void setUp() {
        owner = newUser(Role.USER);
        stranger = newUser(Role.USER);
        clearInvocations(userPostsCache);
    }

    private AuthenticatedUser newUser(Role role) {
        String id = UUID.randomUUID().toString();
        String name = "u" + id.substring(0, 8);
        userService.createUser(User.builder()
                .id(id)
                .username(name)
                .email(name + "@example.com")
                .passwordHash("$2a$04$notarealhashnotarealhashnotarealhashnotarealhashno")
                .role(role.getValue())
                .build());
        return new AuthenticatedUser(id, name + "@example.com", role);
    }

    @Nested
    @DisplayName("getUserPosts")
    class GetUserPosts {

        @Test
        void returnsNewestFirstAndPopulatesCache() {
            Post first = postService.createPost(owner.userId(), "first");
            Post second = postService.createPost(owner.userId(), "second");

            List<Post> posts = postService.getUserPosts(owner.userId());

            assertThat(posts).extracting(Post::getId).containsExactlyInAnyOrder(first.getId(), second.getId());
            assertThat(posts).isSortedAccordingTo(Comparator.comparing(Post::getCreatedAt).reversed());
            assertThat(userPostsCache.get(owner.userId())).isPresent();
        }

        @Test
        void unknownUserHasNoPosts() {
            assertThat(postService.getUserPosts("missing")).isEmpty();
        }
    }

    @Nested
    @DisplayName("cache consistency")
    class CacheConsistency {

        @Test
        void createIsVisibleToNextRead() {
            postService.createPost(owner.userId(), "before");
            assertThat(postService.getUserPosts(owner.userId())).hasSize(1);

            Post created = postService.createPost(owner.userId(), "after");

            assertThat(postService.getUserPosts(owner.userId()))
                    .extracting(Post::getId)
                    .contains(created.getId())
                    .hasSize(2);
        }

        @Test
        void updateIsVisibleToNextRead() {
            Post post = postService.createPost(owner.userId(), "draft");
            postService.getUserPosts(owner.userId());

            Post updated = postService.updatePost(post.getId(), "final", owner);

            assertThat(updated.getUpdatedAt()).isNotNull();
            assertThat(postService.getUserPosts(owner.userId()))
                    .singleElement()
                    .satisfies(p -> assertThat(p.getContent()).isEqualTo("final"));
        }

        @Test
        void deleteIsVisibleToNextRead() {
            Post post = postService.createPost(owner.userId(), "gone soon");
            postService.getUserPosts(owner.userId());

            assertThat(postService.deletePost(post.getId(), owner)).isTrue();

            assertThat(postService.getUserPosts(owner.userId())).isEmpty();
            verify(userPostsCache, atLeastOnce()).evict(owner.userId());
        }

        @Test
        void missingPostUpdateDoesNotTouchCache() {
            assertThatThrownBy(() -> postService.updatePost("missing", "x", owner))
                    .isInstanceOfSatisfying(BusinessException.class, ex ->
                            assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND));

            verify(userPostsCache, never()).evict(anyString());
        }

        @Test
        void missingPostDeleteDoesNotTouchCache() {
            assertThatThrownBy(() -> postService.deletePost("missing", owner))
                    .isInstanceOfSatisfying(BusinessException.class, ex ->
                            assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND));

            verify(userPostsCache, never()).evict(anyString());
        }
    }

    @Nested
    @DisplayName("ownership")
    class Ownership {

        @Test
        void strangerCannotUpdate() {
            Post post = postService.createPost(owner.userId(), "mine");

            assertThatThrownBy(() -> postService.updatePost(post.getId(), "yours", stranger))
                    .isInstanceOfSatisfying(BusinessException.class, ex ->
                            assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
            assertThat(postService.findById(post.getId())).hasValueSatisfying(p ->
                    assertThat(p.getContent()).isEqualTo("mine"));
        }

        @Test
        void adminCanDeleteAnyPost() {
            Post post = postService.createPost(owner.userId(), "moderated");
            AuthenticatedUser admin = newUser(Role.ADMIN);

            assertThat(postService.deletePost(post.getId(), admin)).isTrue();
            assertThat(postService.findById(post.getId())).isEmpty();
        }
    }

    @Nested
    @DisplayName("content rules")
    class ContentRules {

        @Test
        void blankContentIsRejectedOnCreate() {
            assertThatThrownBy(() -> postService.createPost(owner.userId(), "   "))
                    .isInstanceOfSatisfying(ValidationException.class, ex ->
                            assertThat(ex.getErrors()).containsKey("content"));
        }

        @Test
        void oversizedContentIsRejectedOnUpdate() {
            Post post = postService.createPost(owner.userId(), "short");

            assertThatThrownBy(() -> postService.updatePost(post.getId(), "x".repeat(4001), owner))
                    .isInstanceOfSatisfying(ValidationException.class, ex ->
                            assertThat(ex.getErrors()).containsKey("newContent"));
        }

        @Test
        void contentIsTrimmed() {
            Post post = postService.createPost(owner.userId(), "  hello  ");

            assertThat(post.getContent()).isEqualTo("hello");
        }

        @Test
        void unknownOwnerIsNotFound() {
            assertThatThrownBy(() -> postService.createPost("missing", "hello"))
                    .isInstanceOfSatisfying(BusinessException.class, ex ->
                            assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND));
        }
    }

    @Test
    void searchFiltersAndPages() {
        postService.createPost(owner.userId(), "a Spring post");
        postService.createPost(owner.userId(), "cooking notes");
        postService.createPost(stranger.userId(), "the spring reply");

        PageResult<Post> page = postService.search(
                PostFilter.builder().contentContains("spring").build(),
                new PostOrder(PostOrder.Field.CONTENT, SortDirection.ASC), 0, 1);

        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.items()).extracting(Post::getContent).containsExactly("a Spring post");
        assertThat(page.hasNext()).isTrue();
    }
}

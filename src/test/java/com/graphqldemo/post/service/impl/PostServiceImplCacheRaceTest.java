package com.graphqldemo.post.service.impl;

import com.github.benmanes.caffeine.cache.Ticker;
import com.graphqldemo.auth.security.AuthenticatedUser;
import com.graphqldemo.auth.security.Role;
import com.graphqldemo.cache.CaffeineUserPostsCache;
import com.graphqldemo.cache.config.CacheProperties;
import com.graphqldemo.post.mapper.PostMapper;
import com.graphqldemo.post.model.Post;
import com.graphqldemo.user.service.UserService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionSynchronizationUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * 读与写交错时帖子缓存的一致性。
 */
@ExtendWith(MockitoExtension.class)
class PostServiceImplCacheRaceTest {

    private static final String USER_ID = "u-1";

    @Mock
    private PostMapper mapper;
    @Mock
    private UserService userService;

    private CaffeineUserPostsCache cache;
    private PostServiceImpl service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        cache = new CaffeineUserPostsCache(100, Ticker.systemTicker());
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        service = new PostServiceImpl(mapper, userService, cache, new CacheProperties(), clock);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void loadOverlappingCommitIsNotCached() throws Exception {
        Post post = Post.builder().id("p-1").userId(USER_ID).content("old").build();
        CountDownLatch loaded = new CountDownLatch(1);
        CountDownLatch committed = new CountDownLatch(1);
        AtomicBoolean firstLoad = new AtomicBoolean(true);
        when(mapper.findById("p-1")).thenReturn(post);
        when(mapper.deleteById("p-1")).thenReturn(1);
        when(mapper.listByUserId(USER_ID)).thenAnswer(invocation -> {
            if (firstLoad.getAndSet(false)) {
                loaded.countDown();
                assertThat(committed.await(5, SECONDS)).isTrue();
                return List.of(post);
            }
            return List.of();
        });

        // 写事务：删除并立即失效，提交后回调尚未执行
        TransactionSynchronizationManager.initSynchronization();
        service.deletePost("p-1", new AuthenticatedUser(USER_ID, "u@example.com", Role.USER));

        // 读线程未命中，读到提交前的旧数据后停住
        Future<List<Post>> reader = executor.submit(() -> service.getUserPosts(USER_ID));
        assertThat(loaded.await(5, SECONDS)).isTrue();

        TransactionSynchronizationUtils.invokeAfterCommit(TransactionSynchronizationManager.getSynchronizations());
        TransactionSynchronizationManager.clearSynchronization();
        committed.countDown();

        assertThat(reader.get(5, SECONDS)).extracting(Post::getId).containsExactly("p-1");
        assertThat(cache.get(USER_ID)).isEmpty();
        assertThat(service.getUserPosts(USER_ID)).isEmpty();
    }

    @Test
    void loadWithoutConcurrentWriteIsCached() {
        Post post = Post.builder().id("p-1").userId(USER_ID).content("kept").build();
        when(mapper.listByUserId(USER_ID)).thenReturn(List.of(post));

        service.getUserPosts(USER_ID);

        assertThat(cache.get(USER_ID)).hasValueSatisfying(posts ->
                assertThat(posts).extracting(Post::getContent).containsExactly("kept"));
    }
}

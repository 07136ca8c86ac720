package com.graphqldemo.user.service.impl;

import com.graphqldemo.common.page.PageResult;
import com.graphqldemo.user.domain.User;
import com.graphqldemo.user.domain.UserFilter;
import com.graphqldemo.user.domain.UserOrder;
import com.graphqldemo.user.mapper.UserMapper;
import com.graphqldemo.user.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserMapper userMapper;
    private final Clock clock;

    /**
     * 根据邮箱查询用户。
     *
     * @param email 邮箱地址（已标准化为小写）。
     * @return 用户 Optional。
     */
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return Optional.ofNullable(userMapper.findByEmail(email));
    }

    /**
     * 根据 ID 查询用户。
     *
     * @param id 用户 ID。
     * @return 用户 Optional。
     */
    @Transactional(readOnly = true)
    public Optional<User> findById(String id) {
        return Optional.ofNullable(userMapper.findById(id));
    }

    /**
     * 批量查询用户，供 DataLoader 合并作者查询。
     *
     * @param ids 用户 ID 集合。
     * @return ID -> 用户，不存在的 ID 不出现在结果中。
     */
    @Transactional(readOnly = true)
    public Map<String, User> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyMap();
        }
        List<User> users = userMapper.listByIds(ids);
        return users.stream().collect(Collectors.toMap(User::getId, Function.identity(), (a, b) -> a));
    }

    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return userMapper.existsByEmail(email);
    }

    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return userMapper.existsByUsername(username);
    }

    /**
     * 创建用户，写入创建与更新时间并持久化。
     *
     * @param user 待创建的用户实体（需包含 ID）。
     * @return 持久化后的用户实体。
     */
    @Transactional
    public User createUser(User user) {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        userMapper.insert(user);
        return user;
    }

    @Transactional(readOnly = true)
    public PageResult<User> search(UserFilter filter, UserOrder order, int offset, int limit) {
        UserFilter safeFilter = filter == null ? UserFilter.none() : filter;
        UserOrder safeOrder = order == null ? UserOrder.defaultOrder() : order;
        long total = userMapper.count(safeFilter);
        List<User> users = userMapper.search(safeFilter, safeOrder, limit, offset);
        return new PageResult<>(users, offset, total);
    }
}

package com.graphqldemo.user.service;

import com.graphqldemo.common.page.PageResult;
import com.graphqldemo.user.domain.User;
import com.graphqldemo.user.domain.UserFilter;
import com.graphqldemo.user.domain.UserOrder;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * 用户领域服务接口。
 */
public interface UserService {

    Optional<User> findByEmail(String email);

    Optional<User> findById(String id);

    Map<String, User> findByIds(Collection<String> ids);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    User createUser(User user);

    PageResult<User> search(UserFilter filter, UserOrder order, int offset, int limit);
}

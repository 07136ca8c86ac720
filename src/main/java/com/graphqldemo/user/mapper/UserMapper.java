package com.graphqldemo.user.mapper;

import com.graphqldemo.user.domain.User;
import com.graphqldemo.user.domain.UserFilter;
import com.graphqldemo.user.domain.UserOrder;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface UserMapper {

    User findByEmail(@Param("email") String email);

    User findById(@Param("id") String id);

    boolean existsByEmail(@Param("email") String email);

    boolean existsByUsername(@Param("username") String username);

    void insert(User user);

    List<User> listByIds(@Param("ids") Collection<String> ids);

    List<User> search(@Param("filter") UserFilter filter,
                      @Param("order") UserOrder order,
                      @Param("limit") int limit,
                      @Param("offset") int offset);

    long count(@Param("filter") UserFilter filter);
}

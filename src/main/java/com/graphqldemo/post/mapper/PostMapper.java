package com.graphqldemo.post.mapper;

import com.graphqldemo.post.model.Post;
import com.graphqldemo.post.model.PostFilter;
import com.graphqldemo.post.model.PostOrder;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface PostMapper {

    void insert(Post post);

    Post findById(@Param("id") String id);

    int updateContent(Post post);

    int deleteById(@Param("id") String id);

    // 指定用户的全部帖子，按创建时间倒序
    List<Post> listByUserId(@Param("userId") String userId);

    List<Post> search(@Param("filter") PostFilter filter,
                      @Param("order") PostOrder order,
                      @Param("limit") int limit,
                      @Param("offset") int offset);

    long count(@Param("filter") PostFilter filter);
}

package com.graphqldemo.graphql.pagination;

import com.graphqldemo.common.page.PageResult;
import graphql.schema.DataFetchingEnvironment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 解析 first/after 参数并把查询结果组装成连接。
 */
@Component
@RequiredArgsConstructor
public class ConnectionSupport {

    private final PagingProperties properties;

    /**
     * first 缺省取默认页大小，并限制在 [1, maxSize]；after 为上一页最后一条的游标。
     */
    public PageRequest pageRequest(DataFetchingEnvironment env) {
        Integer first = env.getArgument("first");
        String after = env.getArgument("after");
        int limit = first == null ? properties.getDefaultSize() : first;
        limit = Math.min(Math.max(limit, 1), properties.getMaxSize());
        int offset = after == null || after.isBlank() ? 0 : CursorCodec.decode(after) + 1;
        return new PageRequest(offset, limit);
    }

    public <T> Connection<T> toConnection(PageResult<T> page) {
        return toConnection(page, Function.identity());
    }

    public <S, T> Connection<T> toConnection(PageResult<S> page, Function<S, T> mapper) {
        List<Connection.Edge<T>> edges = new ArrayList<>(page.items().size());
        for (int i = 0; i < page.items().size(); i++) {
            edges.add(new Connection.Edge<>(CursorCodec.encode(page.offset() + i), mapper.apply(page.items().get(i))));
        }
        String startCursor = edges.isEmpty() ? null : edges.get(0).cursor();
        String endCursor = edges.isEmpty() ? null : edges.get(edges.size() - 1).cursor();
        Connection.PageInfo pageInfo = new Connection.PageInfo(page.hasNext(), page.hasPrevious(), startCursor, endCursor);
        return new Connection<>(edges, pageInfo, page.totalCount());
    }
}

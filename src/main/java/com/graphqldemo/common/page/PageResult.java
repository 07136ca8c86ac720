package com.graphqldemo.common.page;

import java.util.List;

/**
 * 一页查询结果。
 *
 * @param items      当前页数据
 * @param offset     当前页首条记录在完整结果中的位置（0 起）
 * @param totalCount 满足条件的总条数
 */
public record PageResult<T>(List<T> items, int offset, long totalCount) {

    public PageResult {
        items = List.copyOf(items);
    }

    public boolean hasNext() {
        return offset + items.size() < totalCount;
    }

    public boolean hasPrevious() {
        return offset > 0;
    }

    /**
     * 对内存中的完整列表切片。
     */
    public static <T> PageResult<T> slice(List<T> all, int offset, int limit) {
        int from = Math.min(Math.max(offset, 0), all.size());
        int to = Math.min(from + Math.max(limit, 0), all.size());
        return new PageResult<>(all.subList(from, to), from, all.size());
    }
}

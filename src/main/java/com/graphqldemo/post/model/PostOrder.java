package com.graphqldemo.post.model;

import com.graphqldemo.common.page.SortDirection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 帖子列表排序，默认按创建时间倒序。列名由枚举决定，不接收任意文本。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PostOrder {

    private Field field;
    private SortDirection direction;

    public static PostOrder defaultOrder() {
        return new PostOrder(Field.CREATED_AT, SortDirection.DESC);
    }

    public enum Field {
        CREATED_AT("created_at"),
        CONTENT("content");

        private final String column;

        Field(String column) {
            this.column = column;
        }
    }

    public String getColumn() {
        return (field == null ? Field.CREATED_AT : field).column;
    }

    public String getSqlDirection() {
        return (direction == null ? SortDirection.DESC : direction).name();
    }
}

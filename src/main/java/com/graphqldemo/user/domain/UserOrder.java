package com.graphqldemo.user.domain;

import com.graphqldemo.common.page.SortDirection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户列表排序，默认按注册时间正序。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserOrder {

    private Field field;
    private SortDirection direction;

    public static UserOrder defaultOrder() {
        return new UserOrder(Field.CREATED_AT, SortDirection.ASC);
    }

    public enum Field {
        USERNAME("username"),
        EMAIL("email"),
        CREATED_AT("created_at");

        private final String column;

        Field(String column) {
            this.column = column;
        }
    }

    public String getColumn() {
        return (field == null ? Field.CREATED_AT : field).column;
    }

    public String getSqlDirection() {
        return (direction == null ? SortDirection.ASC : direction).name();
    }
}

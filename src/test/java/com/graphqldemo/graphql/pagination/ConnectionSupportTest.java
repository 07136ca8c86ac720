package com.graphqldemo.graphql.pagination;

import com.graphqldemo.auth.exception.ValidationException;
import com.graphqldemo.common.page.PageResult;
import graphql.schema.DataFetchingEnvironment;
import graphql.schema.DataFetchingEnvironmentImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionSupportTest {

    private ConnectionSupport support;

    @BeforeEach
    void setUp() {
        support = new ConnectionSupport(new PagingProperties());
    }

    private static DataFetchingEnvironment env(Integer first, String after) {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("first", first);
        arguments.put("after", after);
        return DataFetchingEnvironmentImpl.newDataFetchingEnvironment().arguments(arguments).build();
    }

    @Nested
    @DisplayName("pageRequest")
    class PageRequests {

        @Test
        void defaultsToTenFromStart() {
            assertThat(support.pageRequest(env(null, null))).isEqualTo(new PageRequest(0, 10));
        }

        @Test
        void clampsFirstToConfiguredBounds() {
            assertThat(support.pageRequest(env(500, null)).limit()).isEqualTo(50);
            assertThat(support.pageRequest(env(0, null)).limit()).isEqualTo(1);
            assertThat(support.pageRequest(env(-3, null)).limit()).isEqualTo(1);
        }

        @Test
        void lastIntCursorIsAValidationError() {
            assertThatThrownBy(() -> support.pageRequest(env(5, CursorCodec.encode(Integer.MAX_VALUE))))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void continuesAfterCursor() {
            assertThat(support.pageRequest(env(5, CursorCodec.encode(9)))).isEqualTo(new PageRequest(10, 5));
        }
    }

    @Nested
    @DisplayName("toConnection")
    class ToConnection {

        @Test
        void buildsEdgesAndPageInfo() {
            PageResult<String> page = PageResult.slice(List.of("a", "b", "c", "d", "e"), 1, 2);

            Connection<String> connection = support.toConnection(page);

            assertThat(connection.edges()).extracting(Connection.Edge::node).containsExactly("b", "c");
            assertThat(connection.totalCount()).isEqualTo(5);
            assertThat(connection.pageInfo().hasNextPage()).isTrue();
            assertThat(connection.pageInfo().hasPreviousPage()).isTrue();
            assertThat(CursorCodec.decode(connection.pageInfo().startCursor())).isEqualTo(1);
            assertThat(CursorCodec.decode(connection.pageInfo().endCursor())).isEqualTo(2);
        }

        @Test
        void emptyPageHasNoCursors() {
            Connection<String> connection = support.toConnection(PageResult.slice(List.<String>of(), 0, 10));

            assertThat(connection.edges()).isEmpty();
            assertThat(connection.pageInfo().startCursor()).isNull();
            assertThat(connection.pageInfo().hasNextPage()).isFalse();
            assertThat(connection.pageInfo().hasPreviousPage()).isFalse();
        }

        @Test
        void lastPageHasNoNext() {
            Connection<Integer> connection = support.toConnection(
                    PageResult.slice(List.of("x", "yy", "zzz"), 2, 10), String::length);

            assertThat(connection.edges()).extracting(Connection.Edge::node).containsExactly(3);
            assertThat(connection.pageInfo().hasNextPage()).isFalse();
        }
    }
}

package com.graphqldemo.common.page;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageResultTest {

    private final List<Integer> all = List.of(1, 2, 3, 4, 5);

    @Test
    void slicesWithinBounds() {
        PageResult<Integer> page = PageResult.slice(all, 2, 2);

        assertThat(page.items()).containsExactly(3, 4);
        assertThat(page.totalCount()).isEqualTo(5);
        assertThat(page.hasNext()).isTrue();
        assertThat(page.hasPrevious()).isTrue();
    }

    @Test
    void offsetPastEndIsEmpty() {
        PageResult<Integer> page = PageResult.slice(all, 9, 3);

        assertThat(page.items()).isEmpty();
        assertThat(page.offset()).isEqualTo(5);
        assertThat(page.hasNext()).isFalse();
    }
}

package com.taskboard.servicebackend.task;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageSpecTest {

    @Test
    void clampsOutOfRangeValuesToDefaults() {
        assertThat(PageSpec.parse("0", "500")).isEqualTo(new PageSpec(1, 10));
        assertThat(PageSpec.parse("-3", "0")).isEqualTo(new PageSpec(1, 10));
        assertThat(PageSpec.parse("2", "100")).isEqualTo(new PageSpec(2, 100));
        assertThat(PageSpec.parse("4", "1")).isEqualTo(new PageSpec(4, 1));
    }

    @Test
    void nonNumericInputFallsBackToDefaults() {
        assertThat(PageSpec.parse("abc", "ten")).isEqualTo(PageSpec.first());
        assertThat(PageSpec.parse(null, " ")).isEqualTo(PageSpec.first());
        assertThat(PageSpec.parse(" 3 ", "25")).isEqualTo(new PageSpec(3, 25));
    }

    @Test
    void offsetSkipsPreviousPages() {
        assertThat(new PageSpec(1, 10).offset()).isZero();
        assertThat(new PageSpec(3, 20).offset()).isEqualTo(40);
    }

    @Test
    void offsetOfAHugePageDoesNotOverflow() {
        PageSpec spec = PageSpec.parse("300000000", "100");

        assertThat(spec.page()).isEqualTo(300_000_000);
        assertThat(spec.offset()).isEqualTo(29_999_999_900L);
    }

    @Test
    void pageArithmetic() {
        TaskPage empty = new TaskPage(List.of(), 1, 10, 0);
        assertThat(empty.totalPages()).isZero();
        assertThat(empty.hasNext()).isFalse();
        assertThat(empty.hasPrevious()).isFalse();

        TaskPage middle = new TaskPage(List.of(), 2, 10, 25);
        assertThat(middle.totalPages()).isEqualTo(3);
        assertThat(middle.hasNext()).isTrue();
        assertThat(middle.hasPrevious()).isTrue();

        TaskPage last = new TaskPage(List.of(), 3, 10, 30);
        assertThat(last.totalPages()).isEqualTo(3);
        assertThat(last.hasNext()).isFalse();
    }
}

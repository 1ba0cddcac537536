package dev.vibeshowcase.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageParamsTest {

    @Test
    @DisplayName("Should use defaults when parameters are missing")
    void shouldUseDefaults() {
        PageParams params = PageParams.parse(null, null, 6);

        assertThat(params.page()).isEqualTo(1);
        assertThat(params.limit()).isEqualTo(6);
        assertThat(params.offset()).isZero();
    }

    @Test
    @DisplayName("Should fall back on malformed, zero or negative values")
    void shouldFallBackOnBadValues() {
        assertThat(PageParams.parse("abc", "-3", 10)).isEqualTo(new PageParams(1, 10));
        assertThat(PageParams.parse("0", "0", 10)).isEqualTo(new PageParams(1, 10));
        assertThat(PageParams.parse("  ", "2.5", 4)).isEqualTo(new PageParams(1, 4));
    }

    @Test
    @DisplayName("Should cap the limit")
    void shouldCapLimit() {
        assertThat(PageParams.parse("1", "5000", 6).limit()).isEqualTo(PageParams.MAX_LIMIT);
    }

    @Test
    @DisplayName("Should compute the offset from page and limit")
    void shouldComputeOffset() {
        assertThat(PageParams.parse("3", "6", 6).offset()).isEqualTo(12L);
    }
}

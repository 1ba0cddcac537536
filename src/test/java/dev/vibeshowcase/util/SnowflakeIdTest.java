package dev.vibeshowcase.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnowflakeIdTest {

    private static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

    @Test
    @DisplayName("Should generate unique, increasing ids")
    void shouldGenerateUniqueIncreasingIds() {
        SnowflakeId generator = new SnowflakeId(3);
        Set<Long> seen = new HashSet<>();
        long previous = -1;
        for (int i = 0; i < 5_000; i++) {
            long id = generator.nextId();
            assertThat(id).isGreaterThan(previous);
            assertThat(seen.add(id)).isTrue();
            previous = id;
        }
    }

    @Test
    @DisplayName("Should stay within the JavaScript safe integer range")
    void shouldStayJsSafe() {
        long id = new SnowflakeId(SnowflakeId.MAX_NODE_ID).nextId();

        assertThat(id).isPositive().isLessThanOrEqualTo(MAX_SAFE_INTEGER);
    }

    @Test
    @DisplayName("Should encode node id and creation time")
    void shouldEncodeNodeAndTime() {
        Instant before = Instant.now();
        long id = new SnowflakeId(7).nextId();

        assertThat(SnowflakeId.extractNodeId(id)).isEqualTo(7);
        assertThat(Duration.between(before, SnowflakeId.extractInstant(id)).abs()).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should reject out-of-range node ids")
    void shouldRejectInvalidNodeId() {
        assertThatThrownBy(() -> new SnowflakeId(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SnowflakeId(SnowflakeId.MAX_NODE_ID + 1)).isInstanceOf(IllegalArgumentException.class);
    }
}

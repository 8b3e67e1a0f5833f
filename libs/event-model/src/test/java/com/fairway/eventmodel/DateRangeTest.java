package com.fairway.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DateRange")
class DateRangeTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-02-01T00:00:00Z");

    @Test
    @DisplayName("isValid holds exactly when start is not after end")
    void validity() {
        assertThat(DateRange.of(T0, T1).isValid()).isTrue();
        assertThat(DateRange.of(T0, T0).isValid()).isTrue();
        assertThat(DateRange.of(T1, T0).isValid()).isFalse();
    }

    @Test
    @DisplayName("contains is half-open")
    void halfOpen() {
        var range = DateRange.of(T0, T1);

        assertThat(range.contains(T0)).isTrue();
        assertThat(range.contains(T1)).isFalse();
        assertThat(range.contains(T1.minusNanos(1))).isTrue();
    }

    @Test
    @DisplayName("a zero-length range is empty but valid")
    void emptyRange() {
        assertThat(DateRange.of(T0, T0).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("rejects null bounds")
    void nullBounds() {
        assertThatThrownBy(() -> DateRange.of(null, T1)).isInstanceOf(IllegalArgumentException.class);
    }
}

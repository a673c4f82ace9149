package com.scholary.consult.scribe.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeRangeTest {

  @Test
  void constructor_shouldRejectNegativeStart() {
    assertThatThrownBy(() -> new TimeRange(-1, 10))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void constructor_shouldRejectEndBeforeStart() {
    assertThatThrownBy(() -> new TimeRange(10, 5))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("End time must be >= start time");
  }

  @Test
  void duration_shouldCalculateCorrectly() {
    assertThat(new TimeRange(10_000, 25_500).durationMs()).isEqualTo(15_500);
  }

  @Test
  void contains_shouldBeHalfOpen() {
    TimeRange range = new TimeRange(10, 20);
    assertThat(range.contains(10)).isTrue();
    assertThat(range.contains(19)).isTrue();
    assertThat(range.contains(20)).isFalse();
    assertThat(range.contains(9)).isFalse();
  }

  @Test
  void overlaps_shouldNotCountSharedBoundary() {
    TimeRange first = new TimeRange(0, 45_000);
    TimeRange second = new TimeRange(45_000, 90_000);

    assertThat(first.overlaps(second)).isFalse();
    assertThat(first.isFollowedBy(second)).isTrue();
    assertThat(first.overlaps(new TimeRange(44_999, 50_000))).isTrue();
  }
}

package org.waabox.completist.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CompletenessStats}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CompletenessStatsTest {

  @Test
  void whenAggregating_givenMixedRecords_shouldSummarizeThem() {
    // Arrange
    final List<SeriesCompleteness> records = List.of(
        series("A", 100, List.of()),
        series("B", 50, List.of(
            new MissingEpisode(1, 2, "Two", LocalDate.of(2020, 1, 2)))),
        series("C", 25, List.of(
            new MissingEpisode(1, 2, "Two", LocalDate.of(2020, 1, 2)),
            new MissingEpisode(1, 3, "Three", LocalDate.of(2020, 1, 3)),
            new MissingEpisode(1, 4, "Four", LocalDate.of(2020, 1, 4)))));

    // Act
    final CompletenessStats stats = CompletenessStats.of(records);

    // Assert
    assertEquals(3, stats.total());
    assertEquals(1, stats.complete());
    assertEquals(2, stats.incomplete());
    assertEquals(4, stats.totalMissing());
    assertEquals(58, stats.averageCompleteness());
  }

  @Test
  void whenAggregating_givenNoRecords_shouldReturnZeroes() {
    final CompletenessStats stats = CompletenessStats.of(List.of());

    assertEquals(0, stats.total());
    assertEquals(0, stats.averageCompleteness());
  }

  private static SeriesCompleteness series(final String title,
      final int percentage, final List<MissingEpisode> missing) {
    return new SeriesCompleteness(title, Scope.all(), "1", 1, 4, 1, 1,
        List.of(), missing, percentage, 1, null, null, "Ended",
        Instant.EPOCH);
  }
}

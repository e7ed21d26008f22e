package org.waabox.completist.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.waabox.completist.MutableClock;

/**
 * Tests for {@link ResponseCache}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ResponseCacheTest {

  private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  void whenGetting_givenFreshEntry_shouldReturnIt() {
    // Arrange
    final MutableClock clock = new MutableClock(START);
    final ResponseCache<String> cache = new ResponseCache<>(
        Duration.ofMinutes(5), clock);
    cache.put("/movie/1", "value");
    clock.advance(Duration.ofMinutes(4));

    // Act & Assert
    assertEquals("value", cache.get("/movie/1").orElseThrow());
  }

  @Test
  void whenGetting_givenExpiredEntry_shouldMissAndEvict() {
    final MutableClock clock = new MutableClock(START);
    final ResponseCache<String> cache = new ResponseCache<>(
        Duration.ofMinutes(5), clock);
    cache.put("/movie/1", "value");
    clock.advance(Duration.ofMinutes(5));

    assertTrue(cache.get("/movie/1").isEmpty());
    assertEquals(0, cache.stats().size());
  }

  @Test
  void whenGetting_givenUnknownKey_shouldMiss() {
    final ResponseCache<String> cache = new ResponseCache<>(
        Duration.ofMinutes(5), new MutableClock(START));

    assertTrue(cache.get("/nothing").isEmpty());
  }

  @Test
  void whenBuildingKey_givenParamsInAnyOrder_shouldProduceSameKey() {
    final Map<String, String> first = new LinkedHashMap<>();
    first.put("query", "alien");
    first.put("year", "1979");
    final Map<String, String> second = new LinkedHashMap<>();
    second.put("year", "1979");
    second.put("query", "alien");

    assertEquals(ResponseCache.key("/search/movie", first),
        ResponseCache.key("/search/movie", second));
    assertEquals("/search/movie?query=alien&year=1979",
        ResponseCache.key("/search/movie", first));
  }

  @Test
  void whenBuildingKey_givenNoParams_shouldUseEndpoint() {
    assertEquals("/tv/1", ResponseCache.key("/tv/1", Map.of()));
  }

  @Test
  void whenClearing_shouldDropEverything() {
    final ResponseCache<String> cache = new ResponseCache<>(
        Duration.ofMinutes(5), new MutableClock(START));
    cache.put("a", "1");
    cache.put("b", "2");

    cache.clear();

    assertEquals(0, cache.stats().size());
    assertTrue(cache.get("a").isEmpty());
  }

  @Test
  void whenReadingStats_shouldReportOldestAge() {
    final MutableClock clock = new MutableClock(START);
    final ResponseCache<String> cache = new ResponseCache<>(
        Duration.ofMinutes(5), clock);
    cache.put("a", "1");
    clock.advance(Duration.ofSeconds(30));
    cache.put("b", "2");
    clock.advance(Duration.ofSeconds(10));

    final ResponseCache.Stats stats = cache.stats();

    assertEquals(2, stats.size());
    assertEquals(Duration.ofSeconds(40), stats.oldestEntryAge());
  }
}

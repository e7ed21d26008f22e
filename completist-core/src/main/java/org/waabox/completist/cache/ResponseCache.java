package org.waabox.completist.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-boxed memoization of catalog responses keyed by request signature.
 *
 * <p>Entries expire {@code ttl} after they were stored. Expired entries are
 * evicted when they are read.
 *
 * <p>This class is thread-safe.
 *
 * @param <V> the type of the cached responses
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ResponseCache<V> {

  /** The default time to live of an entry. */
  public static final Duration DEFAULT_TTL = Duration.ofHours(24);

  /** The time to live of every entry. */
  private final Duration ttl;

  /** The clock used to stamp and expire entries. */
  private final Clock clock;

  /** The cached entries, keyed by request signature. */
  private final Map<String, Entry<V>> entries = new ConcurrentHashMap<>();

  /**
   * Creates a new cache.
   *
   * @param ttl   the time to live of every entry, never null
   * @param clock the clock, never null
   */
  public ResponseCache(final Duration ttl, final Clock clock) {
    this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Builds the signature of a request.
   *
   * <p>Parameters are sorted by name, so the same request always maps to
   * the same key regardless of the parameter order.
   *
   * @param endpoint the catalog endpoint, never null
   * @param params   the query parameters, never null
   * @return the request signature, never null
   */
  public static String key(final String endpoint,
      final Map<String, String> params) {
    Objects.requireNonNull(endpoint, "endpoint must not be null");
    Objects.requireNonNull(params, "params must not be null");
    if (params.isEmpty()) {
      return endpoint;
    }
    final StringBuilder key = new StringBuilder(endpoint).append('?');
    boolean first = true;
    for (final Map.Entry<String, String> param
        : new TreeMap<>(params).entrySet()) {
      if (!first) {
        key.append('&');
      }
      key.append(param.getKey()).append('=').append(param.getValue());
      first = false;
    }
    return key.toString();
  }

  /**
   * Looks up a fresh entry.
   *
   * @param key the request signature, never null
   * @return the cached value, or empty if absent or expired
   */
  public Optional<V> get(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    final Entry<V> entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (isExpired(entry)) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  /**
   * Stores a value, replacing any previous one for the same key.
   *
   * @param key   the request signature, never null
   * @param value the value to cache, never null
   */
  public void put(final String key, final V value) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(value, "value must not be null");
    entries.put(key, new Entry<>(value, clock.instant()));
  }

  /** Drops every entry. */
  public void clear() {
    entries.clear();
  }

  /**
   * Returns the number of entries and the age of the oldest one.
   *
   * @return the cache statistics, never null
   */
  public Stats stats() {
    final Instant now = clock.instant();
    Duration oldest = Duration.ZERO;
    for (final Entry<V> entry : entries.values()) {
      final Duration age = Duration.between(entry.storedAt(), now);
      if (age.compareTo(oldest) > 0) {
        oldest = age;
      }
    }
    return new Stats(entries.size(), oldest);
  }

  /**
   * Checks whether the entry outlived the time to live.
   *
   * @param entry the entry to check, never null
   * @return true if the entry expired
   */
  private boolean isExpired(final Entry<V> entry) {
    return !entry.storedAt().plus(ttl).isAfter(clock.instant());
  }

  /**
   * A cached value.
   *
   * @param value    the cached value
   * @param storedAt when the value was stored
   * @param <V>      the value type
   */
  private record Entry<V>(V value, Instant storedAt) {
  }

  /**
   * Cache statistics.
   *
   * @param size           the number of entries, expired ones included
   * @param oldestEntryAge the age of the oldest entry
   */
  public record Stats(int size, Duration oldestEntryAge) {
  }
}

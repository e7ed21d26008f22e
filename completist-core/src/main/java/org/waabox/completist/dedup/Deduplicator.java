package org.waabox.completist.dedup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.job.AnalysisProgress;
import org.waabox.completist.job.CancellationToken;
import org.waabox.completist.job.ProgressListener;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;
import org.waabox.completist.store.LibraryStore;

/**
 * Merges the owned items contributed by several providers into one
 * canonical item per catalog entity.
 *
 * <p>Items are grouped by catalog id, resolving missing ids through the
 * {@link CatalogIdResolver}. When two items share an id, the one with the
 * higher quality proxy is kept. Items that cannot be resolved are kept
 * apart, each one being its own unit. Newly resolved movie ids are cached
 * back into the store.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class Deduplicator {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      Deduplicator.class);

  /** The progress phase reported while resolving ids. */
  public static final String PHASE = "deduplicating";

  /** The catalog id resolver, never null. */
  private final CatalogIdResolver resolver;

  /** The store receiving the resolved ids, never null. */
  private final LibraryStore store;

  /**
   * Creates a new deduplicator.
   *
   * @param theResolver the catalog id resolver, never null
   * @param theStore    the store receiving the resolved ids, never null
   */
  public Deduplicator(final CatalogIdResolver theResolver,
      final LibraryStore theStore) {
    resolver = Objects.requireNonNull(theResolver,
        "resolver must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
  }

  /**
   * Resolves the catalog id of every owned movie, caching the new ones in
   * the store.
   *
   * <p>The result keeps the input order and size; movies that could not
   * be resolved come back unchanged. Resolution stops early on
   * cancellation and the movies not yet visited are returned unchanged.
   *
   * @param movies   the owned movies, never null
   * @param token    the cancellation token, never null
   * @param listener the progress listener, never null
   * @return the movies with their catalog ids, never null
   */
  public List<OwnedItem> resolveMovies(final List<OwnedItem> movies,
      final CancellationToken token, final ProgressListener listener) {
    Objects.requireNonNull(movies, "movies must not be null");
    Objects.requireNonNull(token, "token must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    final List<OwnedItem> result = new ArrayList<>(movies.size());
    int position = 0;
    for (final OwnedItem movie : movies) {
      if (movie.hasCatalogId() || token.isCancelled()) {
        result.add(movie);
        continue;
      }
      listener.onProgress(new AnalysisProgress(position++, movies.size(),
          movie.title(), PHASE, 0));
      final Optional<String> id = resolver.resolveMovie(movie);
      if (id.isPresent()) {
        store.updateCatalogId(movie.id(), id.get());
        result.add(movie.withCatalogId(id.get()));
      } else {
        result.add(movie);
      }
    }
    return result;
  }

  /**
   * Deduplicates owned movies.
   *
   * <p>Missing ids are resolved first as in {@link #resolveMovies}. The
   * result holds one movie per catalog id followed by the unresolved
   * movies in their original order.
   *
   * @param movies   the owned movies of every provider, never null
   * @param token    the cancellation token, never null
   * @param listener the progress listener, never null
   * @return the canonical movies, never null
   */
  public List<OwnedItem> movies(final List<OwnedItem> movies,
      final CancellationToken token, final ProgressListener listener) {
    final Map<String, OwnedItem> byId = new LinkedHashMap<>();
    final List<OwnedItem> unresolved = new ArrayList<>();

    for (final OwnedItem movie : resolveMovies(movies, token, listener)) {
      if (movie.hasCatalogId()) {
        byId.merge(movie.catalogId(), movie, Deduplicator::better);
      } else {
        unresolved.add(movie);
      }
    }

    log.info("Deduplicated {} movies into {} catalog entries and {}"
        + " unresolved", movies.size(), byId.size(), unresolved.size());

    final List<OwnedItem> result = new ArrayList<>(byId.values());
    result.addAll(unresolved);
    return result;
  }

  /**
   * Deduplicates owned episodes into series.
   *
   * <p>Episodes are grouped by series title, each title is resolved to a
   * show id and titles sharing an id are merged under the first title
   * seen. Within a merged series, episodes are deduplicated by season and
   * episode number. On cancellation the remaining titles are grouped
   * without resolution.
   *
   * @param episodes the owned episodes of every provider, never null
   * @param scope    the scope the episodes were read from, never null
   * @param token    the cancellation token, never null
   * @param listener the progress listener, never null
   * @return the series, never null
   */
  public List<SeriesGroup> series(final List<OwnedItem> episodes,
      final Scope scope, final CancellationToken token,
      final ProgressListener listener) {
    Objects.requireNonNull(episodes, "episodes must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    Objects.requireNonNull(token, "token must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    final Map<String, List<OwnedItem>> byTitle = byTitle(episodes);

    final Map<String, SeriesGroup> byId = new LinkedHashMap<>();
    final List<SeriesGroup> unresolved = new ArrayList<>();

    int position = 0;
    for (final Map.Entry<String, List<OwnedItem>> entry : byTitle.entrySet()) {
      final String title = entry.getKey();
      if (token.isCancelled()) {
        unresolved.add(group(title, null, scope, entry.getValue()));
        continue;
      }
      listener.onProgress(new AnalysisProgress(position++, byTitle.size(),
          title, PHASE, 0));

      final Optional<String> id = resolver.resolveShow(title,
          entry.getValue());
      if (id.isEmpty()) {
        unresolved.add(group(title, null, scope, entry.getValue()));
        continue;
      }
      byId.merge(id.get(), group(title, id.get(), scope, entry.getValue()),
          (first, second) -> {
            log.debug("Merging series '{}' into '{}'", second.title(),
                first.title());
            final List<OwnedItem> merged = new ArrayList<>(first.episodes());
            merged.addAll(second.episodes());
            return group(first.title(), first.catalogId(), scope, merged);
          });
    }

    log.info("Deduplicated {} series titles into {} catalog series and {}"
        + " unresolved", byTitle.size(), byId.size(), unresolved.size());

    final List<SeriesGroup> result = new ArrayList<>(byId.values());
    result.addAll(unresolved);
    return result;
  }

  /**
   * Groups episodes by series title without any catalog lookup.
   *
   * <p>The show id of a group is the first one carried by its episodes.
   *
   * @param episodes the owned episodes, never null
   * @param scope    the scope the episodes were read from, never null
   * @return the series, never null
   */
  public static List<SeriesGroup> groupByTitle(
      final List<OwnedItem> episodes, final Scope scope) {
    Objects.requireNonNull(episodes, "episodes must not be null");
    Objects.requireNonNull(scope, "scope must not be null");

    final List<SeriesGroup> result = new ArrayList<>();
    byTitle(episodes).forEach((title, items) -> {
      final String catalogId = items.stream()
          .map(OwnedItem::seriesCatalogId)
          .filter(Objects::nonNull)
          .findFirst()
          .orElse(null);
      result.add(group(title, catalogId, scope, items));
    });
    return result;
  }

  /**
   * Groups episodes by series title, keeping the first-seen order.
   * Episodes without a series title are ignored.
   */
  private static Map<String, List<OwnedItem>> byTitle(
      final List<OwnedItem> episodes) {
    final Map<String, List<OwnedItem>> byTitle = new LinkedHashMap<>();
    for (final OwnedItem episode : episodes) {
      if (episode.seriesTitle() == null) {
        log.debug("Ignoring episode {} without a series title",
            episode.id());
        continue;
      }
      byTitle.computeIfAbsent(episode.seriesTitle(),
          title -> new ArrayList<>()).add(episode);
    }
    return byTitle;
  }

  /**
   * Builds a series group, keeping the best copy of every episode.
   */
  private static SeriesGroup group(final String title,
      final String catalogId, final Scope scope,
      final List<OwnedItem> episodes) {
    final Map<String, OwnedItem> byKey = new LinkedHashMap<>();
    final List<OwnedItem> unnumbered = new ArrayList<>();
    for (final OwnedItem episode : episodes) {
      final String key = episode.episodeKey();
      if (key == null) {
        unnumbered.add(episode);
      } else {
        byKey.merge(key, episode, Deduplicator::better);
      }
    }
    final List<OwnedItem> result = new ArrayList<>(byKey.values());
    result.addAll(unnumbered);
    return new SeriesGroup(title, catalogId, scope, result);
  }

  /**
   * Returns the item with the higher quality proxy, the first one on a
   * tie.
   */
  private static OwnedItem better(final OwnedItem first,
      final OwnedItem second) {
    return second.qualityProxy() > first.qualityProxy() ? second : first;
  }
}

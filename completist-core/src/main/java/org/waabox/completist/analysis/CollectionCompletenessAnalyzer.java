package org.waabox.completist.analysis;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.catalog.CatalogCollection;
import org.waabox.completist.catalog.CatalogMovie;
import org.waabox.completist.catalog.ImageSize;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.model.CollectionCompleteness;
import org.waabox.completist.model.MissingMovie;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.store.ArtworkUpdate;
import org.waabox.completist.store.LibraryStore;

/**
 * Computes the completeness of a movie collection.
 *
 * <p>Only members with a release date that is not in the future count. A
 * collection with at most one released member is not a real collection
 * and yields no record. Owned movies from local sources get the poster of
 * their catalog entry written back.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CollectionCompletenessAnalyzer extends
    AbstractCompletenessAnalyzer<CollectionUnit, CollectionCompleteness> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CollectionCompletenessAnalyzer.class);

  /** The video catalog, never null. */
  private final VideoCatalog catalog;

  /** The store receiving artwork, never null. */
  private final LibraryStore store;

  /**
   * Creates a new analyzer.
   *
   * @param theCatalog the video catalog, never null
   * @param theStore   the library store, never null
   * @param clock      the clock that defines today, never null
   */
  public CollectionCompletenessAnalyzer(final VideoCatalog theCatalog,
      final LibraryStore theStore, final Clock clock) {
    super(clock);
    catalog = Objects.requireNonNull(theCatalog, "catalog must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public String describe(final CollectionUnit unit) {
    return "collection " + unit.collectionId();
  }

  /** Collections are only ever found through a catalog id. */
  @Override
  protected Optional<String> resolveId(final CollectionUnit unit) {
    return Optional.of(unit.collectionId());
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<CollectionCompleteness> unmatched(
      final CollectionUnit unit) {
    return Optional.empty();
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<CollectionCompleteness> compute(
      final CollectionUnit unit, final String collectionId) {
    final CatalogCollection collection = catalog.collection(collectionId);

    final List<CatalogMovie> released = collection.parts().stream()
        .filter(part -> releaseDates().isReleased(part.releaseDate()))
        .toList();

    if (released.size() <= 1) {
      log.debug("Collection '{}' has {} released members, not tracking it",
          collection.name(), released.size());
      return Optional.empty();
    }

    final Map<String, OwnedItem> owned = new HashMap<>();
    for (final OwnedItem movie : unit.ownedMovies()) {
      if (movie.hasCatalogId()) {
        owned.putIfAbsent(movie.catalogId(), movie);
      }
    }

    final List<MissingMovie> missing = new ArrayList<>();
    final List<String> ownedIds = new ArrayList<>();
    for (final CatalogMovie part : released) {
      final OwnedItem movie = owned.get(part.id());
      if (movie == null) {
        missing.add(new MissingMovie(part.id(), part.title(), part.year(),
            catalog.imageUrl(part.posterPath(), ImageSize.W300)));
        continue;
      }
      ownedIds.add(part.id());
      if (movie.sourceType().isLocal() && part.posterPath() != null) {
        final String posterUrl = catalog.imageUrl(part.posterPath(),
            ImageSize.W500);
        pushArtwork(movie.title(), () -> store.updateArtwork(movie.id(),
            ArtworkUpdate.poster(posterUrl)));
      }
    }

    final int total = released.size();
    final int ownedCount = total - missing.size();

    return Optional.of(new CollectionCompleteness(collectionId,
        collection.name(), unit.scope(), total, ownedCount, missing,
        ownedIds, Percentages.of(ownedCount, total),
        unit.ownedMovies().size(),
        catalog.imageUrl(collection.posterPath(), ImageSize.W500),
        catalog.imageUrl(collection.backdropPath(), ImageSize.ORIGINAL),
        now()));
  }
}

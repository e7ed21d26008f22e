package org.waabox.completist.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Completeness of one movie collection.
 *
 * <p>Only released members are counted.
 *
 * @param collectionId           the collection catalog id, never null
 * @param name                   the collection name, may be null
 * @param scope                  the analyzed scope, never null
 * @param totalMovies            the released members
 * @param ownedMovies            the owned released members
 * @param missingMovies          released members that are not owned
 * @param ownedMovieIds          the catalog ids of the owned members
 * @param completenessPercentage the completeness, within [0, 100]
 * @param ownedItemCount         the owned movies the analysis used
 * @param posterUrl              the collection poster, may be null
 * @param backdropUrl            the collection backdrop, may be null
 * @param updatedAt              when the record was written, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CollectionCompleteness(
    String collectionId,
    String name,
    Scope scope,
    int totalMovies,
    int ownedMovies,
    List<MissingMovie> missingMovies,
    List<String> ownedMovieIds,
    int completenessPercentage,
    int ownedItemCount,
    String posterUrl,
    String backdropUrl,
    Instant updatedAt) implements CompletenessRecord {

  /** Validates the record and freezes its lists. */
  public CollectionCompleteness {
    Objects.requireNonNull(collectionId, "collectionId must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    missingMovies = missingMovies == null
        ? List.of() : List.copyOf(missingMovies);
    ownedMovieIds = ownedMovieIds == null
        ? List.of() : List.copyOf(ownedMovieIds);
    CompletenessRecord.requireValidPercentage(completenessPercentage);
  }

  /** {@inheritDoc} */
  @Override
  public String unitKey() {
    return collectionId;
  }

  /** {@inheritDoc} */
  @Override
  public int totalCount() {
    return totalMovies;
  }

  /** {@inheritDoc} */
  @Override
  public int ownedCount() {
    return ownedMovies;
  }

  /** {@inheritDoc} */
  @Override
  public int missingCount() {
    return missingMovies.size();
  }
}

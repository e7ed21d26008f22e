package org.waabox.completist.analysis;

import java.util.List;
import java.util.Objects;

import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;

/**
 * A movie collection together with the owned movies that belong to it.
 *
 * @param collectionId the collection catalog id, never null
 * @param scope        the analyzed scope, never null
 * @param ownedMovies  the owned members, each carrying its catalog id
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CollectionUnit(String collectionId, Scope scope,
    List<OwnedItem> ownedMovies) {

  /** Validates the unit and freezes its movies. */
  public CollectionUnit {
    Objects.requireNonNull(collectionId, "collectionId must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    ownedMovies = ownedMovies == null ? List.of() : List.copyOf(ownedMovies);
  }
}

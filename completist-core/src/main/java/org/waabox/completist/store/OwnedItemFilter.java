package org.waabox.completist.store;

import java.util.Objects;

import org.waabox.completist.model.MediaKind;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;

/**
 * Selects owned items from the library store.
 *
 * @param kind        the item kind, never null
 * @param scope       the provider/library scope, never null
 * @param seriesTitle restricts episodes to one series, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record OwnedItemFilter(MediaKind kind, Scope scope,
    String seriesTitle) {

  /** Validates the mandatory fields. */
  public OwnedItemFilter {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
  }

  /**
   * Selects every owned movie in a scope.
   *
   * @param scope the scope, never null
   * @return the filter, never null
   */
  public static OwnedItemFilter movies(final Scope scope) {
    return new OwnedItemFilter(MediaKind.MOVIE, scope, null);
  }

  /**
   * Selects every owned episode in a scope.
   *
   * @param scope the scope, never null
   * @return the filter, never null
   */
  public static OwnedItemFilter episodes(final Scope scope) {
    return new OwnedItemFilter(MediaKind.EPISODE, scope, null);
  }

  /**
   * Selects the owned episodes of one series in a scope.
   *
   * @param seriesTitle the series title, never null
   * @param scope       the scope, never null
   * @return the filter, never null
   */
  public static OwnedItemFilter episodesOf(final String seriesTitle,
      final Scope scope) {
    Objects.requireNonNull(seriesTitle, "seriesTitle must not be null");
    return new OwnedItemFilter(MediaKind.EPISODE, scope, seriesTitle);
  }

  /**
   * Tests an item against this filter.
   *
   * @param item the item, never null
   * @return true if the item is selected
   */
  public boolean matches(final OwnedItem item) {
    return item.kind() == kind
        && scope.covers(item.sourceId(), item.libraryId())
        && (seriesTitle == null || seriesTitle.equals(item.seriesTitle()));
  }
}

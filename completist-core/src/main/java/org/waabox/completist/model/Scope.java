package org.waabox.completist.model;

import java.util.Objects;

/**
 * The provider/library scope of an analysis or of a completeness record.
 *
 * <p>A null source id means every provider; a null library id means every
 * library of the source.
 *
 * @param sourceId  the library provider id, null for every provider
 * @param libraryId the library id within the provider, null for every
 *                  library
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Scope(String sourceId, String libraryId) {

  /** The scope covering every provider and library. */
  private static final Scope ALL = new Scope(null, null);

  /** Validates that a library is only given together with its source. */
  public Scope {
    if (sourceId == null && libraryId != null) {
      throw new IllegalArgumentException(
          "libraryId requires a sourceId, got library: " + libraryId);
    }
  }

  /**
   * Returns the scope covering every provider and library.
   *
   * @return the cross-provider scope, never null
   */
  public static Scope all() {
    return ALL;
  }

  /**
   * Returns the scope of every library of one provider.
   *
   * @param sourceId the provider id, never null
   * @return the scope, never null
   */
  public static Scope of(final String sourceId) {
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    return new Scope(sourceId, null);
  }

  /**
   * Returns the scope of one library of one provider.
   *
   * @param sourceId  the provider id, never null
   * @param libraryId the library id, never null
   * @return the scope, never null
   */
  public static Scope of(final String sourceId, final String libraryId) {
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    Objects.requireNonNull(libraryId, "libraryId must not be null");
    return new Scope(sourceId, libraryId);
  }

  /**
   * Tells whether this scope spans every provider.
   *
   * @return true if no provider was selected
   */
  public boolean crossProvider() {
    return sourceId == null;
  }

  /**
   * Tells whether something living in the given source and library falls
   * inside this scope.
   *
   * @param theSourceId  the source of the item, may be null
   * @param theLibraryId the library of the item, may be null
   * @return true if the item is covered by this scope
   */
  public boolean covers(final String theSourceId, final String theLibraryId) {
    if (sourceId == null) {
      return true;
    }
    if (!sourceId.equals(theSourceId)) {
      return false;
    }
    return libraryId == null || libraryId.equals(theLibraryId);
  }

  /**
   * Returns a stable key for this scope, used to index records.
   *
   * @return the key, never null
   */
  public String key() {
    return (sourceId == null ? "*" : sourceId) + "/"
        + (libraryId == null ? "*" : libraryId);
  }
}

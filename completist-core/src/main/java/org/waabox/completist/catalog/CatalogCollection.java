package org.waabox.completist.catalog;

import java.util.List;

/**
 * A movie collection and its members.
 *
 * @param id           the catalog id, never null
 * @param name         the collection name, may be null
 * @param posterPath   the poster image path, may be null
 * @param backdropPath the backdrop image path, may be null
 * @param parts        the member movies, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogCollection(String id, String name, String posterPath,
    String backdropPath, List<CatalogMovie> parts) {

  /** Freezes the member list. */
  public CatalogCollection {
    parts = parts == null ? List.of() : List.copyOf(parts);
  }
}

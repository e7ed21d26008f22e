package org.waabox.completist.catalog;

import java.util.List;

/**
 * The catalog entities matching an industry cross reference id.
 *
 * @param movieIds the matching movie ids, never null
 * @param showIds  the matching show ids, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ExternalIdMatches(List<String> movieIds, List<String> showIds) {

  /** Freezes the id lists. */
  public ExternalIdMatches {
    movieIds = movieIds == null ? List.of() : List.copyOf(movieIds);
    showIds = showIds == null ? List.of() : List.copyOf(showIds);
  }
}

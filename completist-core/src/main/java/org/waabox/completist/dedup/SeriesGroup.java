package org.waabox.completist.dedup;

import java.util.List;
import java.util.Objects;

import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;

/**
 * The owned episodes of one series, possibly merged from many providers.
 *
 * @param title     the canonical series title, never null
 * @param catalogId the show catalog id, null if unresolved
 * @param scope     the scope the episodes were read from, never null
 * @param episodes  the owned episodes, one per season and episode number
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SeriesGroup(String title, String catalogId, Scope scope,
    List<OwnedItem> episodes) {

  /** Validates the group and freezes its episodes. */
  public SeriesGroup {
    Objects.requireNonNull(title, "title must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    episodes = episodes == null ? List.of() : List.copyOf(episodes);
  }

  /**
   * Returns the owned episodes outside the specials season.
   *
   * @return the regular episodes, never null
   */
  public List<OwnedItem> regularEpisodes() {
    return episodes.stream().filter(episode -> !episode.special()).toList();
  }
}

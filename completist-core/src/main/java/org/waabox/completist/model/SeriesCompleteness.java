package org.waabox.completist.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Completeness of one TV series.
 *
 * <p>Counts exclude the specials season and anything not yet aired.
 *
 * @param seriesTitle            the canonical series title, never null
 * @param scope                  the analyzed scope, never null
 * @param catalogId              the show catalog id, null when unmatched
 * @param totalSeasons           the released seasons
 * @param totalEpisodes          the aired episodes
 * @param ownedSeasons           the seasons with at least one owned episode
 * @param ownedEpisodes          the owned aired episodes
 * @param missingSeasons         released seasons without any owned episode
 * @param missingEpisodes        aired episodes that are not owned
 * @param completenessPercentage the completeness, within [0, 100]
 * @param ownedItemCount         the owned episodes the analysis used
 * @param posterUrl              the show poster, may be null
 * @param backdropUrl            the show backdrop, may be null
 * @param status                 the catalog status, such as "Ended"
 * @param updatedAt              when the record was written, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SeriesCompleteness(
    String seriesTitle,
    Scope scope,
    String catalogId,
    int totalSeasons,
    int totalEpisodes,
    int ownedSeasons,
    int ownedEpisodes,
    List<Integer> missingSeasons,
    List<MissingEpisode> missingEpisodes,
    int completenessPercentage,
    int ownedItemCount,
    String posterUrl,
    String backdropUrl,
    String status,
    Instant updatedAt) implements CompletenessRecord {

  /** Validates the record and freezes its lists. */
  public SeriesCompleteness {
    Objects.requireNonNull(seriesTitle, "seriesTitle must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    missingSeasons = missingSeasons == null
        ? List.of() : List.copyOf(missingSeasons);
    missingEpisodes = missingEpisodes == null
        ? List.of() : List.copyOf(missingEpisodes);
    CompletenessRecord.requireValidPercentage(completenessPercentage);
  }

  /** {@inheritDoc} */
  @Override
  public String unitKey() {
    return seriesTitle;
  }

  /** {@inheritDoc} */
  @Override
  public int totalCount() {
    return totalEpisodes;
  }

  /** {@inheritDoc} */
  @Override
  public int ownedCount() {
    return ownedEpisodes;
  }

  /** {@inheritDoc} */
  @Override
  public int missingCount() {
    return missingEpisodes.size();
  }

  /**
   * Tells whether the series could not be matched against the catalog.
   *
   * @return true if no catalog id was resolved
   */
  public boolean unmatched() {
    return catalogId == null;
  }
}

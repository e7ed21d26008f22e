package org.waabox.completist.analysis;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.catalog.CatalogEpisode;
import org.waabox.completist.catalog.CatalogSeason;
import org.waabox.completist.catalog.CatalogSeasonSummary;
import org.waabox.completist.catalog.CatalogShow;
import org.waabox.completist.catalog.ImageSize;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.dedup.CatalogIdResolver;
import org.waabox.completist.dedup.SeriesGroup;
import org.waabox.completist.http.CatalogException;
import org.waabox.completist.model.MissingEpisode;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.SeriesCompleteness;
import org.waabox.completist.store.ArtworkUpdate;
import org.waabox.completist.store.LibraryStore;

/**
 * Computes the completeness of a TV series.
 *
 * <p>The specials season and every season or episode that has not aired
 * yet are left out. Seasons are fetched in chunks of
 * {@link VideoCatalog#MAX_SEASONS_PER_CALL}; when a chunk fails, its
 * seasons are fetched one by one and the ones that still fail are
 * ignored; when no released season can be fetched at all the analysis
 * fails. A released season with aired episodes but nothing owned is
 * reported as a missing season. A show without released seasons is
 * complete.
 *
 * <p>For episodes owned through a local source, the show poster, the
 * episode still and the season poster are written back to the store.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SeriesCompletenessAnalyzer
    extends AbstractCompletenessAnalyzer<SeriesGroup, SeriesCompleteness> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SeriesCompletenessAnalyzer.class);

  /** The status of series the catalog does not describe. */
  private static final String UNKNOWN_STATUS = "Unknown";

  /** The video catalog, never null. */
  private final VideoCatalog catalog;

  /** The catalog id resolver, never null. */
  private final CatalogIdResolver resolver;

  /** The store holding previous records and receiving artwork, never null. */
  private final LibraryStore store;

  /**
   * Creates a new analyzer.
   *
   * @param theCatalog  the video catalog, never null
   * @param theResolver the catalog id resolver, never null
   * @param theStore    the library store, never null
   * @param clock       the clock that defines today, never null
   */
  public SeriesCompletenessAnalyzer(final VideoCatalog theCatalog,
      final CatalogIdResolver theResolver, final LibraryStore theStore,
      final Clock clock) {
    super(clock);
    catalog = Objects.requireNonNull(theCatalog, "catalog must not be null");
    resolver = Objects.requireNonNull(theResolver,
        "resolver must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public String describe(final SeriesGroup unit) {
    return "series '" + unit.title() + "'";
  }

  /**
   * Uses the id of the group, then the id of a previous record of the
   * same series, then the resolver.
   */
  @Override
  protected Optional<String> resolveId(final SeriesGroup unit) {
    if (unit.catalogId() != null) {
      return Optional.of(unit.catalogId());
    }
    final Optional<String> previous = store.record(SeriesCompleteness.class,
        unit.title(), unit.scope()).map(SeriesCompleteness::catalogId);
    if (previous.isPresent()) {
      return previous;
    }
    return resolver.resolveShow(unit.title(), unit.episodes());
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<SeriesCompleteness> unmatched(final SeriesGroup unit) {
    final List<OwnedItem> regular = unit.regularEpisodes();
    return Optional.of(new SeriesCompleteness(unit.title(), unit.scope(),
        null, 0, 0, seasonsOf(regular).size(), regular.size(), List.of(),
        List.of(), 0, unit.episodes().size(), null, null, UNKNOWN_STATUS,
        now()));
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<SeriesCompleteness> compute(final SeriesGroup unit,
      final String showId) {
    final CatalogShow show = catalog.show(showId);
    final String posterUrl = catalog.imageUrl(show.posterPath(),
        ImageSize.W500);
    final String backdropUrl = catalog.imageUrl(show.backdropPath(),
        ImageSize.ORIGINAL);
    final String status = show.status() == null
        ? UNKNOWN_STATUS : show.status();

    final List<OwnedItem> regular = unit.regularEpisodes();
    final Map<String, OwnedItem> owned = new HashMap<>();
    for (final OwnedItem episode : regular) {
      if (episode.episodeKey() != null) {
        owned.put(episode.episodeKey(), episode);
      }
    }

    final List<CatalogSeasonSummary> released = show.seasons().stream()
        .filter(season -> season.seasonNumber() > 0)
        .filter(season -> season.airDate() == null
            || releaseDates().isReleased(season.airDate()))
        .toList();

    final Map<Integer, CatalogSeason> seasons = fetchSeasons(showId,
        released.stream().map(CatalogSeasonSummary::seasonNumber).toList());
    if (!released.isEmpty() && seasons.isEmpty()) {
      throw new CatalogException("None of the " + released.size()
          + " released seasons of show " + showId + " could be fetched");
    }

    final List<Integer> missingSeasons = new ArrayList<>();
    final List<MissingEpisode> missingEpisodes = new ArrayList<>();
    int totalEpisodes = 0;

    for (final CatalogSeasonSummary summary : released) {
      final CatalogSeason season = seasons.get(summary.seasonNumber());
      if (season == null) {
        continue;
      }
      final String seasonPosterUrl = catalog.imageUrl(season.posterPath(),
          ImageSize.W500);

      int aired = 0;
      int ownedInSeason = 0;
      for (final CatalogEpisode episode : season.episodes()) {
        if (!releaseDates().isReleased(episode.airDate())) {
          continue;
        }
        aired++;
        final OwnedItem item = owned.get(String.format("S%02dE%02d",
            episode.seasonNumber(), episode.episodeNumber()));
        if (item == null) {
          missingEpisodes.add(new MissingEpisode(episode.seasonNumber(),
              episode.episodeNumber(), episode.name(), episode.airDate()));
          continue;
        }
        ownedInSeason++;
        if (item.sourceType().isLocal()) {
          final ArtworkUpdate artwork = new ArtworkUpdate(posterUrl,
              catalog.imageUrl(episode.stillPath(), ImageSize.W300),
              seasonPosterUrl);
          pushArtwork(item.title(),
              () -> store.updateArtwork(item.id(), artwork));
        }
      }
      totalEpisodes += aired;
      if (aired > 0 && ownedInSeason == 0) {
        missingSeasons.add(summary.seasonNumber());
      }
    }

    final int ownedEpisodes = Percentages.clamp(regular.size(),
        totalEpisodes);
    final int ownedSeasons = Percentages.clamp(seasonsOf(regular).size(),
        released.size());
    final int percentage;
    if (released.isEmpty()) {
      percentage = 100;
    } else if (totalEpisodes == 0) {
      percentage = 0;
    } else {
      percentage = Percentages.of(ownedEpisodes, totalEpisodes);
    }

    log.debug("Series '{}': {}/{} episodes, {} missing seasons", unit.title(),
        ownedEpisodes, totalEpisodes, missingSeasons.size());

    return Optional.of(new SeriesCompleteness(unit.title(), unit.scope(),
        showId, released.size(), totalEpisodes, ownedSeasons, ownedEpisodes,
        missingSeasons, missingEpisodes, percentage, unit.episodes().size(),
        posterUrl, backdropUrl, status, now()));
  }

  /**
   * Fetches seasons in chunks, falling back to one call per season when a
   * chunk fails.
   *
   * @param showId  the show id, never null
   * @param numbers the season numbers, never null
   * @return the fetched seasons by number, never null
   */
  private Map<Integer, CatalogSeason> fetchSeasons(final String showId,
      final List<Integer> numbers) {
    final Map<Integer, CatalogSeason> result = new HashMap<>();
    for (int i = 0; i < numbers.size(); i += VideoCatalog.MAX_SEASONS_PER_CALL) {
      final List<Integer> chunk = numbers.subList(i,
          Math.min(i + VideoCatalog.MAX_SEASONS_PER_CALL, numbers.size()));
      try {
        for (final CatalogSeason season : catalog.seasons(showId, chunk)) {
          result.put(season.seasonNumber(), season);
        }
      } catch (final CatalogException e) {
        log.warn("Fetching seasons {} of show {} failed, fetching them one"
            + " by one: {}", chunk, showId, e.getMessage());
        for (final Integer number : chunk) {
          try {
            result.put(number, catalog.season(showId, number));
          } catch (final CatalogException seasonError) {
            log.warn("Fetching season {} of show {} failed: {}", number,
                showId, seasonError.getMessage());
          }
        }
      }
    }
    return result;
  }

  /**
   * Returns the distinct season numbers of the given episodes.
   */
  private static Set<Integer> seasonsOf(final List<OwnedItem> episodes) {
    final Set<Integer> seasons = new HashSet<>();
    for (final OwnedItem episode : episodes) {
      if (episode.seasonNumber() != null) {
        seasons.add(episode.seasonNumber());
      }
    }
    return seasons;
  }
}

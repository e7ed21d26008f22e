package org.waabox.completist.analysis;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.catalog.CatalogArtist;
import org.waabox.completist.catalog.Discography;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.catalog.ReleaseGroup;
import org.waabox.completist.http.CatalogException;
import org.waabox.completist.model.ArtistCompleteness;
import org.waabox.completist.model.MissingRelease;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicArtist;
import org.waabox.completist.model.ReleaseType;
import org.waabox.completist.store.LibraryStore;

/**
 * Computes the completeness of an artist's discography.
 *
 * <p>Release groups are split into albums, EPs and singles. Compilations,
 * live records and soundtracks do not count as albums; other primary
 * types are ignored. Release groups first released after today are left
 * out, compared by day when the catalog has a date and by year otherwise.
 * Vinyl-only ones are left out when the unit asks for it.
 *
 * <p>A release group is owned when an owned album carries its id or has
 * the same normalized title. The percentage weights albums, EPs and
 * singles as given by {@link ReleaseType#weight()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class DiscographyAnalyzer
    extends AbstractCompletenessAnalyzer<ArtistUnit, ArtistCompleteness> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      DiscographyAnalyzer.class);

  /** Secondary types that keep an album out of the album category. */
  private static final Set<String> NON_STUDIO = Set.of("Compilation", "Live",
      "Soundtrack");

  /** The music catalog, never null. */
  private final MusicCatalog catalog;

  /** The store receiving resolved artist ids, never null. */
  private final LibraryStore store;

  /**
   * Creates a new analyzer.
   *
   * @param theCatalog the music catalog, never null
   * @param theStore   the library store, never null
   * @param clock      the clock that defines today, never null
   */
  public DiscographyAnalyzer(final MusicCatalog theCatalog,
      final LibraryStore theStore, final Clock clock) {
    super(clock);
    catalog = Objects.requireNonNull(theCatalog, "catalog must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public String describe(final ArtistUnit unit) {
    return "artist '" + unit.artist().name() + "'";
  }

  /**
   * Uses the cached artist id, or else searches the catalog by name and
   * caches the match.
   */
  @Override
  protected Optional<String> resolveId(final ArtistUnit unit) {
    final MusicArtist artist = unit.artist();
    if (artist.catalogId() != null && !artist.catalogId().isBlank()) {
      return Optional.of(artist.catalogId());
    }
    try {
      final Optional<String> id = catalog.searchArtist(artist.name())
          .map(CatalogArtist::id);
      id.ifPresent(found -> {
        log.debug("Caching catalog id {} of artist '{}'", found,
            artist.name());
        store.updateArtistCatalogId(artist.id(), found);
      });
      return id;
    } catch (final CatalogException e) {
      log.warn("Artist search failed for '{}': {}", artist.name(),
          e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * An unknown artist has nothing missing: its record keeps the owned
   * album count and reports full completeness.
   */
  @Override
  protected Optional<ArtistCompleteness> unmatched(final ArtistUnit unit) {
    final int owned = unit.albums().size();
    return Optional.of(new ArtistCompleteness(unit.artist().name(),
        unit.scope(), null, 0, owned, 0, 0, 0, 0, List.of(), List.of(),
        List.of(), 100, owned, null, null, null, unit.artist().thumbUrl(),
        now()));
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<ArtistCompleteness> compute(final ArtistUnit unit,
      final String artistId) {
    final Discography discography = catalog.discography(artistId);
    final LocalDate today = releaseDates().today();

    final Set<String> owned = new HashSet<>();
    for (final MusicAlbum album : unit.albums()) {
      owned.add(TitleNormalizer.release(album.title()));
      if (album.catalogId() != null) {
        owned.add(album.catalogId());
      }
    }

    final Map<ReleaseType, Integer> totals = new EnumMap<>(ReleaseType.class);
    final Map<ReleaseType, List<MissingRelease>> missing =
        new EnumMap<>(ReleaseType.class);
    for (final ReleaseType type : ReleaseType.values()) {
      totals.put(type, 0);
      missing.put(type, new ArrayList<>());
    }

    for (final ReleaseGroup group : discography.releaseGroups()) {
      final Optional<ReleaseType> type = classify(group);
      if (type.isEmpty()) {
        continue;
      }
      if (!isReleased(group, today)) {
        continue;
      }
      if (unit.filterVinylOnly() && !hasDigitalRelease(group)) {
        log.debug("Leaving out vinyl-only release '{}'", group.title());
        continue;
      }
      totals.merge(type.get(), 1, Integer::sum);
      if (!owned.contains(group.id())
          && !owned.contains(TitleNormalizer.release(group.title()))) {
        missing.get(type.get()).add(new MissingRelease(group.id(),
            group.title(), group.firstReleaseYear(), type.get()));
      }
    }

    final int totalAlbums = totals.get(ReleaseType.ALBUM);
    final int totalEps = totals.get(ReleaseType.EP);
    final int totalSingles = totals.get(ReleaseType.SINGLE);
    final int ownedAlbums = totalAlbums - missing.get(ReleaseType.ALBUM).size();
    final int ownedEps = totalEps - missing.get(ReleaseType.EP).size();
    final int ownedSingles = totalSingles
        - missing.get(ReleaseType.SINGLE).size();

    final int percentage = Percentages.weighted(ownedAlbums, totalAlbums,
        ownedEps, totalEps, ownedSingles, totalSingles);

    final CatalogArtist artist = discography.artist();
    return Optional.of(new ArtistCompleteness(unit.artist().name(),
        unit.scope(), artistId, totalAlbums, ownedAlbums, totalEps, ownedEps,
        totalSingles, ownedSingles, missing.get(ReleaseType.ALBUM),
        missing.get(ReleaseType.EP), missing.get(ReleaseType.SINGLE),
        percentage, unit.albums().size(),
        artist == null ? null : artist.country(),
        artist == null ? null : artist.type(),
        artist == null ? null : artist.activeYears(),
        unit.artist().thumbUrl(), now()));
  }

  /**
   * Places a release group in its category.
   *
   * @param group the release group, never null
   * @return the category, or empty if the group does not count
   */
  static Optional<ReleaseType> classify(final ReleaseGroup group) {
    final String primary = group.primaryType();
    if ("Album".equals(primary)) {
      for (final String secondary : group.secondaryTypes()) {
        if (NON_STUDIO.contains(secondary)) {
          return Optional.empty();
        }
      }
      return Optional.of(ReleaseType.ALBUM);
    }
    if ("EP".equals(primary)) {
      return Optional.of(ReleaseType.EP);
    }
    if ("Single".equals(primary)) {
      return Optional.of(ReleaseType.SINGLE);
    }
    return Optional.empty();
  }

  /**
   * Checks whether a release group was out by the given day. Undated
   * groups count as released.
   *
   * @param group the release group, never null
   * @param today the current day, never null
   * @return true if released
   */
  private boolean isReleased(final ReleaseGroup group, final LocalDate today) {
    if (group.firstReleaseDate() != null) {
      return releaseDates().isReleased(group.firstReleaseDate());
    }
    return group.firstReleaseYear() == null
        || group.firstReleaseYear() <= today.getYear();
  }

  /**
   * Checks whether a release group has a digital release. A failing check
   * keeps the group.
   */
  private boolean hasDigitalRelease(final ReleaseGroup group) {
    try {
      return catalog.hasDigitalRelease(group.id());
    } catch (final CatalogException e) {
      log.warn("Format check failed for '{}', keeping it: {}", group.title(),
          e.getMessage());
      return true;
    }
  }
}

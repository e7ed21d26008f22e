package org.waabox.completist.analysis;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.catalog.CatalogRelease;
import org.waabox.completist.catalog.CatalogTrack;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.catalog.ReleaseGroup;
import org.waabox.completist.http.CatalogException;
import org.waabox.completist.model.AlbumCompleteness;
import org.waabox.completist.model.MissingTrack;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicTrack;
import org.waabox.completist.store.LibraryStore;

/**
 * Computes the track completeness of an owned album.
 *
 * <p>The album is matched to a release group by its cached id or by a
 * search on artist and cleaned title, and diffed against the tracklist of
 * an official release of that group by normalized track title. Albums
 * without a match or without a tracklist yield no record. Albums without
 * artwork get the catalog's cover art written back.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class AlbumTrackAnalyzer
    extends AbstractCompletenessAnalyzer<AlbumUnit, AlbumCompleteness> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      AlbumTrackAnalyzer.class);

  /** The music catalog, never null. */
  private final MusicCatalog catalog;

  /** The store receiving resolved ids and artwork, never null. */
  private final LibraryStore store;

  /**
   * Creates a new analyzer.
   *
   * @param theCatalog the music catalog, never null
   * @param theStore   the library store, never null
   * @param clock      the clock that stamps records, never null
   */
  public AlbumTrackAnalyzer(final MusicCatalog theCatalog,
      final LibraryStore theStore, final Clock clock) {
    super(clock);
    catalog = Objects.requireNonNull(theCatalog, "catalog must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public String describe(final AlbumUnit unit) {
    return "album '" + unit.album().artistName() + " - "
        + unit.album().title() + "'";
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<String> resolveId(final AlbumUnit unit) {
    final MusicAlbum album = unit.album();
    if (album.catalogId() != null && !album.catalogId().isBlank()) {
      return Optional.of(album.catalogId());
    }
    try {
      final Optional<String> id = catalog.searchReleaseGroup(
          album.artistName(), TitleNormalizer.forSearch(album.title()))
          .map(ReleaseGroup::id);
      id.ifPresent(found -> store.updateAlbumCatalogId(album.id(), found));
      return id;
    } catch (final CatalogException e) {
      log.warn("Release search failed for {}: {}", describe(unit),
          e.getMessage());
      return Optional.empty();
    }
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<AlbumCompleteness> unmatched(final AlbumUnit unit) {
    return Optional.empty();
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<AlbumCompleteness> compute(final AlbumUnit unit,
      final String releaseGroupId) {
    final MusicAlbum album = unit.album();

    if (!album.hasArtwork()) {
      pushArtwork(describe(unit), () -> catalog.coverArt(releaseGroupId)
          .ifPresent(art -> store.updateAlbumArtwork(album.id(),
              art.thumbUrl(), art.artworkUrl())));
    }

    final Optional<CatalogRelease> release = catalog.tracklist(
        releaseGroupId);
    if (release.isEmpty() || release.get().tracks().isEmpty()) {
      log.debug("No tracklist for {}", describe(unit));
      return Optional.empty();
    }

    final Set<String> owned = new HashSet<>();
    for (final MusicTrack track : unit.tracks()) {
      owned.add(TitleNormalizer.track(track.title()));
    }

    final List<CatalogTrack> tracks = release.get().tracks();
    final List<MissingTrack> missing = new ArrayList<>();
    for (final CatalogTrack track : tracks) {
      if (!owned.contains(TitleNormalizer.track(track.title()))) {
        missing.add(new MissingTrack(track.recordingId(), track.title(),
            track.position(), track.discNumber(), track.lengthMs()));
      }
    }

    final int total = tracks.size();
    final int ownedCount = total - missing.size();
    return Optional.of(new AlbumCompleteness(album.id(), album.artistName(),
        album.title(), unit.scope(), releaseGroupId,
        release.get().releaseId(), total, ownedCount, missing,
        Percentages.of(ownedCount, total), unit.tracks().size(), now()));
  }
}

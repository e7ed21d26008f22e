package org.waabox.completist.job;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.waabox.completist.analysis.AlbumTrackAnalyzer;
import org.waabox.completist.analysis.AlbumUnit;
import org.waabox.completist.analysis.ArtistUnit;
import org.waabox.completist.analysis.DiscographyAnalyzer;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.model.AlbumCompleteness;
import org.waabox.completist.model.ArtistCompleteness;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicArtist;
import org.waabox.completist.model.Scope;
import org.waabox.completist.store.LibraryStore;

/**
 * Analyzes every owned artist discography, then every owned album.
 *
 * <p>Phases: {@code artists}, {@code albums} and {@code complete}. When
 * items are deduplicated across providers, artists with the same name are
 * merged into one unit.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class MusicAnalysisJob extends AnalysisJob {

  /** The job name. */
  public static final String NAME = "music";

  /** The domain reported to metrics for discographies. */
  private static final String ARTIST_DOMAIN = "artists";

  /** The domain reported to metrics for albums. */
  private static final String ALBUM_DOMAIN = "albums";

  /** The music catalog, never null. */
  private final MusicCatalog catalog;

  /** The discography analyzer, never null. */
  private final DiscographyAnalyzer discographyAnalyzer;

  /** The album analyzer, never null. */
  private final AlbumTrackAnalyzer albumAnalyzer;

  /** The library store, never null. */
  private final LibraryStore store;

  /** The batch runner, never null. */
  private final BatchJobRunner runner;

  /** The clock used by the freshness check, never null. */
  private final Clock clock;

  /**
   * Creates a new job.
   *
   * @param theCatalog             the music catalog, never null
   * @param theDiscographyAnalyzer the discography analyzer, never null
   * @param theAlbumAnalyzer       the album analyzer, never null
   * @param theStore               the library store, never null
   * @param theRunner              the batch runner, never null
   * @param theClock               the clock, never null
   * @param runSlot                the slot shared by jobs that cannot
   *                               overlap, never null
   */
  public MusicAnalysisJob(final MusicCatalog theCatalog,
      final DiscographyAnalyzer theDiscographyAnalyzer,
      final AlbumTrackAnalyzer theAlbumAnalyzer, final LibraryStore theStore,
      final BatchJobRunner theRunner, final Clock theClock,
      final AtomicReference<String> runSlot) {
    super(NAME, theStore, runSlot);
    catalog = Objects.requireNonNull(theCatalog, "catalog must not be null");
    discographyAnalyzer = Objects.requireNonNull(theDiscographyAnalyzer,
        "discographyAnalyzer must not be null");
    albumAnalyzer = Objects.requireNonNull(theAlbumAnalyzer,
        "albumAnalyzer must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
    runner = Objects.requireNonNull(theRunner, "runner must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /** {@inheritDoc} */
  @Override
  protected void verifyPreconditions() {
    catalog.verifyCredentials();
  }

  /** {@inheritDoc} */
  @Override
  protected AnalysisResult execute(final Scope scope,
      final AnalysisOptions options, final CancellationToken token,
      final ProgressListener listener) {

    final List<MusicAlbum> albums = store.albums(scope);
    final List<ArtistUnit> artists = artistUnits(store.artists(scope),
        albums, scope, options);

    final BatchOutcome artistOutcome = runner.run(ARTIST_DOMAIN,
        Phases.ARTISTS, artists, new UnitTask<>() {
          @Override
          public String describe(final ArtistUnit unit) {
            return unit.artist().name();
          }

          @Override
          public boolean isFresh(final ArtistUnit unit) {
            final Optional<ArtistCompleteness> previous = store.record(
                ArtistCompleteness.class, unit.artist().name(), scope);
            return previous.isPresent()
                && options.isFresh(previous.get().updatedAt(), clock.instant())
                && previous.get().ownedItemCount() == unit.albums().size();
          }

          @Override
          public void process(final ArtistUnit unit) {
            discographyAnalyzer.analyze(unit).ifPresent(store::upsert);
          }
        }, options, token, listener);

    if (artistOutcome.cancelled()) {
      return new AnalysisResult(false, artistOutcome.analyzed(),
          artistOutcome.skipped());
    }

    final List<AlbumUnit> albumUnits = albums.stream()
        .map(album -> new AlbumUnit(album, store.tracksOfAlbum(album.id()),
            scope))
        .toList();

    final BatchOutcome albumOutcome = runner.run(ALBUM_DOMAIN, Phases.ALBUMS,
        albumUnits, new UnitTask<>() {
          @Override
          public String describe(final AlbumUnit unit) {
            return unit.album().artistName() + " - " + unit.album().title();
          }

          @Override
          public boolean isFresh(final AlbumUnit unit) {
            final Optional<AlbumCompleteness> previous = store.record(
                AlbumCompleteness.class, unit.album().id(), scope);
            return previous.isPresent()
                && options.isFresh(previous.get().updatedAt(), clock.instant())
                && previous.get().ownedItemCount() == unit.tracks().size();
          }

          @Override
          public void process(final AlbumUnit unit) {
            albumAnalyzer.analyze(unit).ifPresent(store::upsert);
          }
        }, options, token, listener);

    final BatchOutcome total = new BatchOutcome(albumOutcome.cancelled(),
        artistOutcome.analyzed() + albumOutcome.analyzed(),
        artistOutcome.skipped() + albumOutcome.skipped(),
        artistOutcome.failed() + albumOutcome.failed());
    return Phases.finish(total, albumUnits.size(), listener);
  }

  /**
   * Builds one unit per artist, merging artists across providers when
   * deduplicating.
   *
   * @param artists the owned artists, never null
   * @param albums  the owned albums, never null
   * @param scope   the scope of the run, never null
   * @param options the run options, never null
   * @return the units, never null
   */
  static List<ArtistUnit> artistUnits(final List<MusicArtist> artists,
      final List<MusicAlbum> albums, final Scope scope,
      final AnalysisOptions options) {

    final Map<String, List<MusicAlbum>> albumsByArtist = new LinkedHashMap<>();
    for (final MusicAlbum album : albums) {
      if (album.artistId() != null) {
        albumsByArtist.computeIfAbsent(album.artistId(),
            id -> new ArrayList<>()).add(album);
      }
    }

    final boolean merge = options.deduplicate(scope);
    final Map<String, MusicArtist> canonical = new LinkedHashMap<>();
    final Map<String, List<MusicAlbum>> merged = new LinkedHashMap<>();

    for (final MusicArtist artist : artists) {
      final String key = merge ? identity(artist) : artist.id();
      final MusicArtist first = canonical.get(key);
      if (first == null) {
        canonical.put(key, artist);
      } else if (first.catalogId() == null && artist.catalogId() != null) {
        canonical.put(key, first.withCatalogId(artist.catalogId()));
      }
      merged.computeIfAbsent(key, k -> new ArrayList<>())
          .addAll(albumsByArtist.getOrDefault(artist.id(), List.of()));
    }

    final List<ArtistUnit> units = new ArrayList<>();
    canonical.forEach((key, artist) -> units.add(new ArtistUnit(artist,
        merged.get(key), scope, options.filterVinylOnly())));
    return units;
  }

  /**
   * Returns the key identifying an artist across providers: its name,
   * case-insensitively.
   */
  private static String identity(final MusicArtist artist) {
    return artist.name().toLowerCase(Locale.ROOT);
  }
}

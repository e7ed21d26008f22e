package org.waabox.completist.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Completist, mapped from the
 * {@code completist.*} prefix in application.yml or
 * application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code completist.store.directory} - where the library document is
 *       kept. When unset the library lives in memory only.</li>
 *   <li>{@code completist.tmdb.enabled}, {@code completist.tmdb.api-key}
 *       and {@code completist.tmdb.base-url} - the film/TV catalog. Without
 *       an api key the {@code tmdb_api_key} store setting is used.</li>
 *   <li>{@code completist.musicbrainz.user-agent} and
 *       {@code completist.musicbrainz.base-url} - the music catalog, only
 *       created when a user agent is set.</li>
 *   <li>{@code completist.analysis.*} - the default run options.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "completist")
public class CompletistProperties {

  /** The library store settings. */
  private final Store store = new Store();

  /** The TMDB settings. */
  private final Tmdb tmdb = new Tmdb();

  /** The MusicBrainz settings. */
  private final MusicBrainz musicbrainz = new MusicBrainz();

  /** The default analysis options. */
  private final Analysis analysis = new Analysis();

  /**
   * Returns the library store settings.
   *
   * @return the settings, never null
   */
  public Store getStore() {
    return store;
  }

  /**
   * Returns the TMDB settings.
   *
   * @return the settings, never null
   */
  public Tmdb getTmdb() {
    return tmdb;
  }

  /**
   * Returns the MusicBrainz settings.
   *
   * @return the settings, never null
   */
  public MusicBrainz getMusicbrainz() {
    return musicbrainz;
  }

  /**
   * Returns the default analysis options.
   *
   * @return the options, never null
   */
  public Analysis getAnalysis() {
    return analysis;
  }

  /** Library store settings. */
  public static class Store {

    /** The directory of the library document, null for memory only. */
    private String directory;

    public String getDirectory() {
      return directory;
    }

    public void setDirectory(final String directory) {
      this.directory = directory;
    }
  }

  /** TMDB settings. */
  public static class Tmdb {

    /** Whether the TMDB catalog is created. */
    private boolean enabled = true;

    /** The API key, null to read the store setting. */
    private String apiKey;

    /** The API base URL, null for the public endpoint. */
    private String baseUrl;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(final boolean enabled) {
      this.enabled = enabled;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(final String apiKey) {
      this.apiKey = apiKey;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
      this.baseUrl = baseUrl;
    }
  }

  /** MusicBrainz settings. */
  public static class MusicBrainz {

    /** The User-Agent sent to MusicBrainz, required to use it. */
    private String userAgent;

    /** The web service base URL, null for the public endpoint. */
    private String baseUrl;

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(final String userAgent) {
      this.userAgent = userAgent;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
      this.baseUrl = baseUrl;
    }
  }

  /** Default analysis options. */
  public static class Analysis {

    /** Whether fresh and unchanged units are skipped. */
    private boolean skipRecentlyAnalyzed = true;

    /** The freshness window, in days. */
    private int reanalyzeAfterDays = 7;

    /** Whether vinyl-only release groups are left out. */
    private boolean filterVinylOnly = false;

    /** The number of units analyzed concurrently. */
    private int concurrency = 5;

    /** The checkpoint interval, in analyzed units. */
    private int checkpointEvery = 25;

    public boolean isSkipRecentlyAnalyzed() {
      return skipRecentlyAnalyzed;
    }

    public void setSkipRecentlyAnalyzed(final boolean skip) {
      skipRecentlyAnalyzed = skip;
    }

    public int getReanalyzeAfterDays() {
      return reanalyzeAfterDays;
    }

    public void setReanalyzeAfterDays(final int days) {
      reanalyzeAfterDays = days;
    }

    public boolean isFilterVinylOnly() {
      return filterVinylOnly;
    }

    public void setFilterVinylOnly(final boolean filter) {
      filterVinylOnly = filter;
    }

    public int getConcurrency() {
      return concurrency;
    }

    public void setConcurrency(final int concurrency) {
      this.concurrency = concurrency;
    }

    public int getCheckpointEvery() {
      return checkpointEvery;
    }

    public void setCheckpointEvery(final int checkpointEvery) {
      this.checkpointEvery = checkpointEvery;
    }
  }
}

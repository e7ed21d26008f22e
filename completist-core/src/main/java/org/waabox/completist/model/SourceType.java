package org.waabox.completist.model;

/**
 * The kind of library provider an owned item comes from.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SourceType {

  /** A Plex media server. */
  PLEX(false),

  /** A Jellyfin media server. */
  JELLYFIN(false),

  /** An Emby media server. */
  EMBY(false),

  /** A Kodi instance reached through its remote API. */
  KODI(false),

  /** A Kodi database read from disk. */
  KODI_LOCAL(true),

  /** Plain local folders. */
  LOCAL(true);

  /** Whether the provider has no embedded artwork metadata. */
  private final boolean local;

  /**
   * Creates a source type.
   *
   * @param isLocal whether the provider has no embedded metadata
   */
  SourceType(final boolean isLocal) {
    local = isLocal;
  }

  /**
   * Tells whether this provider is a local source without embedded
   * metadata, so resolved artwork must be pushed back to it.
   *
   * @return true for local providers
   */
  public boolean isLocal() {
    return local;
  }
}

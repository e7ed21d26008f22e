package org.waabox.completist.analysis;

import org.waabox.completist.model.ReleaseType;

/**
 * Completeness percentage arithmetic.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Percentages {

  /** Utility class. */
  private Percentages() {
  }

  /**
   * Computes round(owned / total * 100), clamped to [0, 100].
   *
   * <p>An empty universe is complete: a total of zero yields 100.
   *
   * @param owned the owned count
   * @param total the total count
   * @return the percentage, within [0, 100]
   */
  public static int of(final int owned, final int total) {
    if (total <= 0) {
      return 100;
    }
    final long percentage = Math.round(owned * 100.0 / total);
    return (int) Math.max(0, Math.min(100, percentage));
  }

  /**
   * Computes a discography percentage, weighting each release category by
   * {@link ReleaseType#weight()}.
   *
   * @param ownedAlbums  the owned albums
   * @param totalAlbums  the catalog albums
   * @param ownedEps     the owned EPs
   * @param totalEps     the catalog EPs
   * @param ownedSingles the owned singles
   * @param totalSingles the catalog singles
   * @return the percentage, within [0, 100]
   */
  public static int weighted(final int ownedAlbums, final int totalAlbums,
      final int ownedEps, final int totalEps, final int ownedSingles,
      final int totalSingles) {
    final int owned = ownedAlbums * ReleaseType.ALBUM.weight()
        + ownedEps * ReleaseType.EP.weight()
        + ownedSingles * ReleaseType.SINGLE.weight();
    final int total = totalAlbums * ReleaseType.ALBUM.weight()
        + totalEps * ReleaseType.EP.weight()
        + totalSingles * ReleaseType.SINGLE.weight();
    return of(owned, total);
  }

  /**
   * Clamps an owned count to the catalog total.
   *
   * @param owned the owned count
   * @param total the catalog total
   * @return the clamped count, never greater than total
   */
  public static int clamp(final int owned, final int total) {
    return Math.max(0, Math.min(owned, total));
  }
}

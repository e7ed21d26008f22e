package org.waabox.completist.model;

/**
 * The release-group categories counted in a discography, with their weight
 * in the completeness percentage.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ReleaseType {

  /** A studio album. */
  ALBUM(3),

  /** An extended play. */
  EP(2),

  /** A single. */
  SINGLE(1);

  /** The weight of one release of this type. */
  private final int weight;

  /**
   * Creates a release type.
   *
   * @param theWeight the weight of one release
   */
  ReleaseType(final int theWeight) {
    weight = theWeight;
  }

  /**
   * Returns the weight of one release of this type.
   *
   * @return the weight, greater than zero
   */
  public int weight() {
    return weight;
  }
}

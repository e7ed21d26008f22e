package org.waabox.completist.catalog;

/**
 * The image renditions requested from the film/TV catalog.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ImageSize {

  /** 300 pixels wide, used for missing item thumbnails. */
  W300("w300"),

  /** 500 pixels wide, used for posters. */
  W500("w500"),

  /** The original upload, used for backdrops. */
  ORIGINAL("original");

  /** The size segment of the image URL. */
  private final String code;

  /**
   * Creates an image size.
   *
   * @param theCode the URL segment
   */
  ImageSize(final String theCode) {
    code = theCode;
  }

  /**
   * Returns the size segment of the image URL.
   *
   * @return the code, never null
   */
  public String code() {
    return code;
  }
}

package org.waabox.completist.analysis;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Normalizes release and track titles so that local titles and catalog
 * titles can be compared.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TitleNormalizer {

  /** A year in parentheses, as in "Album (1996)". */
  private static final Pattern YEAR = Pattern.compile("\\s*\\(\\d{4}\\)\\s*");

  /** An edition marker, as in "Album (Deluxe Edition)". */
  private static final Pattern EDITION = Pattern.compile(
      "\\s*\\((Deluxe|Remaster(ed)?|Anniversary|Expanded|Special|Limited"
          + "|Explicit)\\s*(Edition|Version)?\\)\\s*",
      Pattern.CASE_INSENSITIVE);

  /** A disc marker, as in "Album [Disc 2]" or "Album CD1". */
  private static final Pattern DISC = Pattern.compile(
      "\\s*\\[?(Disc|CD)\\s*\\d+\\]?\\s*", Pattern.CASE_INSENSITIVE);

  /** Anything but word characters and spaces. */
  private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");

  /** Runs of whitespace. */
  private static final Pattern SPACES = Pattern.compile("\\s+");

  /** Utility class. */
  private TitleNormalizer() {
  }

  /**
   * Normalizes a release title, dropping years, edition and disc markers,
   * punctuation and case.
   *
   * @param title the title, never null
   * @return the normalized title, never null
   */
  public static String release(final String title) {
    Objects.requireNonNull(title, "title must not be null");
    String result = YEAR.matcher(title).replaceAll(" ");
    result = EDITION.matcher(result).replaceAll(" ");
    result = DISC.matcher(result).replaceAll(" ");
    result = PUNCTUATION.matcher(result.toLowerCase(Locale.ROOT))
        .replaceAll("");
    return SPACES.matcher(result).replaceAll(" ").trim();
  }

  /**
   * Normalizes a track title, dropping punctuation and case.
   *
   * @param title the title, never null
   * @return the normalized title, never null
   */
  public static String track(final String title) {
    Objects.requireNonNull(title, "title must not be null");
    return PUNCTUATION.matcher(title.toLowerCase(Locale.ROOT))
        .replaceAll("").trim();
  }

  /**
   * Strips the trailing markers that are not part of a canonical release
   * title, keeping case and punctuation. Used to build catalog searches.
   *
   * @param title the title, never null
   * @return the cleaned title, never null
   */
  public static String forSearch(final String title) {
    Objects.requireNonNull(title, "title must not be null");
    String result = title.replaceFirst("\\s*\\(\\d{4}\\)\\s*$", "");
    result = result.replaceFirst("(?i)\\s*\\((Deluxe|Remaster(ed)?"
        + "|Anniversary|Expanded|Special|Limited)\\s*(Edition|Version)?\\)"
        + "\\s*$", "");
    result = result.replaceFirst("(?i)\\s*\\[?(Disc|CD)\\s*\\d+\\]?\\s*$",
        "");
    return result.trim();
  }
}

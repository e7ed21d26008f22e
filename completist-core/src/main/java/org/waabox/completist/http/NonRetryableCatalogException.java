package org.waabox.completist.http;

/**
 * Wraps a catalog failure that retrying cannot fix, such as a 404 or a
 * malformed response.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NonRetryableCatalogException extends CatalogException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public NonRetryableCatalogException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}

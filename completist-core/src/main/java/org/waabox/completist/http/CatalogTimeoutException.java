package org.waabox.completist.http;

/**
 * Thrown when a catalog request exceeds its timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogTimeoutException extends CatalogException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public CatalogTimeoutException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}

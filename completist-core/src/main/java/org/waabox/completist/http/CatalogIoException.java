package org.waabox.completist.http;

/**
 * Thrown when a catalog cannot be reached: connection refused or reset,
 * unknown host, or an interrupted request.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogIoException extends CatalogException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public CatalogIoException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

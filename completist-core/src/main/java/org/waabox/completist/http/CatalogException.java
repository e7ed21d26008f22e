package org.waabox.completist.http;

import org.waabox.completist.CompletistException;

/**
 * Base exception for failures talking to an external catalog.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CatalogException extends CompletistException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public CatalogException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public CatalogException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

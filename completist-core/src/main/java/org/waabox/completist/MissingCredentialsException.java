package org.waabox.completist;

/**
 * Thrown when an external catalog requires credentials that were not
 * configured.
 *
 * <p>It is raised synchronously, before any analysis work is started.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MissingCredentialsException extends CompletistException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public MissingCredentialsException(final String message) {
    super(message);
  }
}

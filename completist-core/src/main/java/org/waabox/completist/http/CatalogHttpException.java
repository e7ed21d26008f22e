package org.waabox.completist.http;

import java.time.Duration;
import java.util.Optional;

/**
 * Thrown when a catalog answers with a non-2xx status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogHttpException extends CatalogException {

  private static final long serialVersionUID = 1L;

  /** The HTTP status returned by the catalog. */
  private final int status;

  /** The message returned by the catalog, may be null. */
  private final String remoteMessage;

  /** The value of the Retry-After header, may be null. */
  private final Duration retryAfter;

  /** Creates a new exception.
   *
   * @param theStatus the HTTP status.
   * @param theRemoteMessage the message sent by the catalog, may be null.
   * @param theRetryAfter the Retry-After delay, may be null.
   */
  public CatalogHttpException(final int theStatus,
      final String theRemoteMessage, final Duration theRetryAfter) {
    super("Catalog responded with HTTP " + theStatus
        + (theRemoteMessage == null ? "" : ": " + theRemoteMessage));
    status = theStatus;
    remoteMessage = theRemoteMessage;
    retryAfter = theRetryAfter;
  }

  /** Returns the HTTP status returned by the catalog.
   *
   * @return the status code.
   */
  public int status() {
    return status;
  }

  /** Returns the message returned by the catalog.
   *
   * @return the remote message, or empty if the body had none.
   */
  public Optional<String> remoteMessage() {
    return Optional.ofNullable(remoteMessage);
  }

  /** Returns the delay requested by the catalog before retrying.
   *
   * @return the Retry-After delay, or empty if the header was absent.
   */
  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}

package org.waabox.completist.analysis;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Decides whether catalog items are released, relative to today.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReleaseDates {

  /** The clock that defines today, never null. */
  private final Clock clock;

  /**
   * Creates a new instance.
   *
   * @param theClock the clock that defines today, never null
   */
  public ReleaseDates(final Clock theClock) {
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /**
   * Returns today's date.
   *
   * @return today, never null
   */
  public LocalDate today() {
    return LocalDate.now(clock);
  }

  /**
   * Tells whether an item with the given date is released. Items without
   * a date are not.
   *
   * @param date the release or air date, may be null
   * @return true if the date is today or in the past
   */
  public boolean isReleased(final LocalDate date) {
    return date != null && !date.isAfter(today());
  }

  /**
   * Returns the clock.
   *
   * @return the clock, never null
   */
  public Clock clock() {
    return clock;
  }
}

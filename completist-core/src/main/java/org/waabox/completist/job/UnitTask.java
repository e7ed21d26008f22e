package org.waabox.completist.job;

/**
 * The per-unit work of a batch run.
 *
 * @param <U> the logical unit type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface UnitTask<U> {

  /**
   * Describes a unit for progress reports and logs.
   *
   * @param unit the unit, never null
   * @return a short description, never null
   */
  String describe(U unit);

  /**
   * Tells whether the unit can be skipped because its stored result is
   * fresh. Must not call any catalog.
   *
   * @param unit the unit, never null
   * @return true to skip the unit
   */
  default boolean isFresh(final U unit) {
    return false;
  }

  /**
   * Analyzes the unit and stores its result.
   *
   * @param unit the unit, never null
   */
  void process(U unit);
}

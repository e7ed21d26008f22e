package org.waabox.completist.model;

/**
 * The kind of an owned video item.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum MediaKind {

  /** A feature film. */
  MOVIE,

  /** A TV episode. */
  EPISODE
}

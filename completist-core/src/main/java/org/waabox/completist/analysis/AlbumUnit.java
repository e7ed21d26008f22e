package org.waabox.completist.analysis;

import java.util.List;
import java.util.Objects;

import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicTrack;
import org.waabox.completist.model.Scope;

/**
 * An owned album together with its owned tracks.
 *
 * @param album  the album, never null
 * @param tracks the owned tracks of the album
 * @param scope  the analyzed scope, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AlbumUnit(MusicAlbum album, List<MusicTrack> tracks,
    Scope scope) {

  /** Validates the unit and freezes its tracks. */
  public AlbumUnit {
    Objects.requireNonNull(album, "album must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    tracks = tracks == null ? List.of() : List.copyOf(tracks);
  }
}

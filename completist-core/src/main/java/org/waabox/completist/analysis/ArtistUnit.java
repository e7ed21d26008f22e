package org.waabox.completist.analysis;

import java.util.List;
import java.util.Objects;

import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicArtist;
import org.waabox.completist.model.Scope;

/**
 * An owned artist together with its owned albums.
 *
 * @param artist          the artist, never null
 * @param albums          the owned albums of the artist
 * @param scope           the analyzed scope, never null
 * @param filterVinylOnly whether vinyl-only release groups are left out
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ArtistUnit(MusicArtist artist, List<MusicAlbum> albums,
    Scope scope, boolean filterVinylOnly) {

  /** Validates the unit and freezes its albums. */
  public ArtistUnit {
    Objects.requireNonNull(artist, "artist must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    albums = albums == null ? List.of() : List.copyOf(albums);
  }
}

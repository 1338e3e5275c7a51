package ca.gc.cra.cadence.infrastructure.resolver;

import ca.gc.cra.cadence.validation.Strings;

/**
 * One track known to a {@link CatalogResolver}.
 *
 * @param artist artist name; must not be blank
 * @param track track title; must not be blank
 * @param album album title; {@code null} becomes empty
 * @since 0.1.0
 */
public record CatalogEntry(String artist, String track, String album) {
  /**
   * Validates and trims the entry.
   */
  public CatalogEntry {
    artist = Strings.requireNonBlank("artist", artist);
    track = Strings.requireNonBlank("track", track);
    album = album == null ? "" : album.trim();
  }
}

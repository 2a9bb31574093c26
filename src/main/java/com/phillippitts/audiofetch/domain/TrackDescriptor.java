package com.phillippitts.audiofetch.domain;

import java.util.Objects;

/**
 * Immutable description of the track being searched for, as produced by the catalog.
 *
 * @param id          catalog identifier of the track
 * @param name        track title
 * @param artist      artist field; several artists are joined with {@code ", "}
 * @param album       album name
 * @param albumArtUrl cover image URL (may be null)
 * @param isrc        International Standard Recording Code (may be null)
 * @param durationMs  track duration in milliseconds (never negative)
 * @param releaseDate release date as reported by the catalog (may be null)
 */
public record TrackDescriptor(
        String id,
        String name,
        String artist,
        String album,
        String albumArtUrl,
        String isrc,
        long durationMs,
        String releaseDate
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if id, name, artist or album is null
     * @throws IllegalArgumentException if durationMs is negative
     */
    public TrackDescriptor {
        Objects.requireNonNull(id, "Track id must not be null");
        Objects.requireNonNull(name, "Track name must not be null");
        Objects.requireNonNull(artist, "Artist must not be null");
        Objects.requireNonNull(album, "Album must not be null");
        if (durationMs < 0) {
            throw new IllegalArgumentException("Duration must not be negative, got: " + durationMs);
        }
    }

    /**
     * Creates a descriptor carrying only the fields needed for searching.
     */
    public static TrackDescriptor of(String id, String name, String artist, String album, long durationMs) {
        return new TrackDescriptor(id, name, artist, album, null, null, durationMs, null);
    }

    /**
     * Filesystem-safe base name: {@code "artist - name"} with everything except letters, digits,
     * spaces, {@code -} and {@code _} removed from each part.
     *
     * @return file name without extension
     */
    public String filename() {
        return sanitize(artist) + " - " + sanitize(name);
    }

    public double durationSeconds() {
        return durationMs / 1000.0;
    }

    public boolean hasIsrc() {
        return isrc != null && !isrc.isBlank();
    }

    private static String sanitize(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        value.codePoints()
                .filter(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_')
                .forEach(sb::appendCodePoint);
        return sb.toString().strip();
    }
}

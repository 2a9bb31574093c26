package com.phillippitts.audiofetch.testutil;

import com.phillippitts.audiofetch.domain.TrackDescriptor;

/**
 * Sample tracks shared by tests.
 */
public final class Tracks {

    private Tracks() {}

    /** 200 second single-artist track without ISRC. */
    public static TrackDescriptor blindingLights() {
        return TrackDescriptor.of("0VjIjW4GlUZAMYd2vXMi3b", "Blinding Lights", "The Weeknd", "After Hours", 200_000);
    }

    public static TrackDescriptor withIsrc(String isrc) {
        return new TrackDescriptor("4uLU6hMCjMI75M1A2tKUQC", "Never Gonna Give You Up", "Rick Astley",
                "Whenever You Need Somebody", null, isrc, 213_000, "1987-11-12");
    }

    public static TrackDescriptor named(String artist, String name) {
        return TrackDescriptor.of(artist + "-" + name, name, artist, "Album", 180_000);
    }
}

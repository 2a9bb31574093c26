package com.phillippitts.audiofetch.service.search;

import com.phillippitts.audiofetch.domain.TrackDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the ordered list of search queries for a track, most specific first.
 *
 * <p>Order:
 * <ol>
 *   <li>{@code artist name}</li>
 *   <li>{@code artist name official audio}</li>
 *   <li>{@code name artist}</li>
 *   <li>{@code isrc} (only when the track has one)</li>
 *   <li>{@code artist name lyrics}</li>
 *   <li>{@code name audio}</li>
 *   <li>{@code name album}</li>
 *   <li>{@code name full song}</li>
 *   <li>{@code firstArtist name} (first entry of a comma-separated artist list)</li>
 * </ol>
 *
 * <p>The orchestrator decides how many of these to use.
 */
@Component
public class QueryGenerator {

    /** Upper bound on the number of generated queries. */
    public static final int MAX_QUERIES = 9;

    /**
     * Generates the queries for {@code track}.
     *
     * @param track track to search for
     * @return immutable list of at most {@link #MAX_QUERIES} queries
     */
    public List<String> generate(TrackDescriptor track) {
        Objects.requireNonNull(track, "track");
        String artist = track.artist();
        String name = track.name();

        List<String> queries = new ArrayList<>(MAX_QUERIES);
        queries.add(artist + " " + name);
        queries.add(artist + " " + name + " official audio");
        queries.add(name + " " + artist);
        if (track.hasIsrc()) {
            queries.add(track.isrc());
        }
        queries.add(artist + " " + name + " lyrics");
        queries.add(name + " audio");
        queries.add(name + " " + track.album());
        queries.add(name + " full song");
        queries.add(firstArtist(artist) + " " + name);
        return List.copyOf(queries);
    }

    static String firstArtist(String artist) {
        int comma = artist.indexOf(',');
        return comma < 0 ? artist : artist.substring(0, comma).strip();
    }
}

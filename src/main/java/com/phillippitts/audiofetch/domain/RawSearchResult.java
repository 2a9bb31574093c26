package com.phillippitts.audiofetch.domain;

/**
 * One unscored entry returned by the search provider.
 *
 * <p>Duration and popularity are boxed so that "unknown" stays distinguishable from zero.
 *
 * @param id          provider-specific video id (may be null)
 * @param url         source URL (may be null when only the id is known)
 * @param title       result title (never null, may be empty)
 * @param durationSec duration in seconds, or null when unknown
 * @param popularity  view count or equivalent, or null when unknown
 */
public record RawSearchResult(
        String id,
        String url,
        String title,
        Double durationSec,
        Long popularity
) {

    public RawSearchResult {
        title = title == null ? "" : title;
    }

    public static RawSearchResult of(String url, String title, Double durationSec, Long popularity) {
        return new RawSearchResult(null, url, title, durationSec, popularity);
    }

    public boolean hasDuration() {
        return durationSec != null && durationSec > 0;
    }

    public boolean hasPopularity() {
        return popularity != null && popularity > 0;
    }
}

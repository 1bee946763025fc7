package com.reviewtrack.domain;

/**
 * Track/model selector for a filtered read. A null model selects every item of the track.
 */
public record ItemSelector(long trackId, String model) {

    public static ItemSelector track(long trackId) {
        return new ItemSelector(trackId, null);
    }
}

package com.phillippitts.tastemodel.service.catalog;

import com.phillippitts.tastemodel.domain.Track;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Owner of {@link Track} records. Reads always see the latest feature vectors and ratings.
 */
public interface TrackStore {

    Optional<Track> find(String trackId);

    List<Track> all();

    /** Inserts or replaces a track. */
    void put(Track track);

    /**
     * Replaces the rating of an existing track.
     *
     * @return the updated track, or empty when the track is unknown
     */
    Optional<Track> applyRating(String trackId, double rating, Instant at);

    int size();

    long ratedCount();
}

package com.phillippitts.tastemodel.service.catalog;

import com.phillippitts.tastemodel.domain.Track;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Heap-resident {@link TrackStore}. Updates replace the whole record atomically per key.
 */
@Component
public class InMemoryTrackStore implements TrackStore {

    private final ConcurrentMap<String, Track> tracks = new ConcurrentHashMap<>();

    @Override
    public Optional<Track> find(String trackId) {
        return Optional.ofNullable(tracks.get(trackId));
    }

    @Override
    public List<Track> all() {
        List<Track> out = new ArrayList<>(tracks.values());
        out.sort(Comparator.comparing(Track::id));
        return out;
    }

    @Override
    public void put(Track track) {
        Objects.requireNonNull(track, "track");
        tracks.put(track.id(), track);
    }

    @Override
    public Optional<Track> applyRating(String trackId, double rating, Instant at) {
        return Optional.ofNullable(tracks.computeIfPresent(trackId, (id, t) -> t.withRating(rating, at)));
    }

    @Override
    public int size() {
        return tracks.size();
    }

    @Override
    public long ratedCount() {
        return tracks.values().stream().filter(Track::isRated).count();
    }
}

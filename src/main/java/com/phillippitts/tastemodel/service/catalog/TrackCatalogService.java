package com.phillippitts.tastemodel.service.catalog;

import com.phillippitts.tastemodel.config.properties.CatalogProperties;
import com.phillippitts.tastemodel.domain.Track;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registers tracks and keeps their feature vectors consistent with the {@link FeatureProvider}.
 *
 * <p>At startup an optional seed file ({@code catalog.seed-path}) is loaded. It is a JSON array of
 * objects with {@code id} (or {@code track_id}), optional {@code category} (or
 * {@code style_source}), optional {@code rating}, and any other keys kept as attributes.
 */
@Service
public class TrackCatalogService {

    private static final Logger LOG = LogManager.getLogger(TrackCatalogService.class);

    private final TrackStore store;
    private final FeatureProvider featureProvider;
    private final CatalogProperties properties;

    public TrackCatalogService(TrackStore store, FeatureProvider featureProvider, CatalogProperties properties) {
        this.store = Objects.requireNonNull(store, "store");
        this.featureProvider = Objects.requireNonNull(featureProvider, "featureProvider");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @PostConstruct
    void loadSeed() {
        String seed = properties.getSeedPath();
        if (seed == null || seed.isBlank()) {
            LOG.info("No catalog seed configured");
            return;
        }
        Path path = Paths.get(seed);
        if (!Files.isRegularFile(path)) {
            LOG.warn("Catalog seed {} does not exist; starting with an empty catalog", path.toAbsolutePath());
            return;
        }
        try {
            int loaded = importJson(Files.readString(path, StandardCharsets.UTF_8));
            LOG.info("Loaded {} tracks from {}", loaded, path.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read catalog seed " + path, e);
        }
    }

    /**
     * Imports a JSON array of track objects.
     *
     * @return number of tracks registered
     * @throws InvalidInputException if the document is not a JSON array of track objects
     */
    public int importJson(String json) {
        JSONArray array;
        try {
            array = new JSONArray(json);
        } catch (JSONException e) {
            throw new InvalidInputException("catalog", "seed is not a JSON array: " + e.getMessage());
        }
        int count = 0;
        for (int i = 0; i < array.length(); i++) {
            JSONObject o = array.optJSONObject(i);
            if (o == null) {
                throw new InvalidInputException("catalog", "entry " + i + " is not an object");
            }
            Map<String, Object> attributes = new HashMap<>(o.toMap());
            String id = stringOrNull(attributes.remove("id"));
            if (id == null) {
                id = stringOrNull(attributes.remove("track_id"));
            }
            String category = stringOrNull(attributes.remove("category"));
            if (category == null) {
                category = stringOrNull(attributes.get("style_source"));
            }
            Object rating = attributes.remove("rating");
            Track track = register(id, category, attributes);
            if (rating instanceof Number n) {
                rate(track.id(), n.doubleValue(), Instant.now());
            }
            count++;
        }
        return count;
    }

    /**
     * Adds a track or refreshes its attributes and features. An existing rating is preserved;
     * null attribute values are ignored.
     */
    public Track register(String trackId, String category, Map<String, Object> attributes) {
        if (trackId == null || trackId.isBlank()) {
            throw new InvalidInputException("id", "track id must not be blank");
        }
        Map<String, Object> attrs = new HashMap<>();
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (k != null && v != null) {
                    attrs.put(k, v);
                }
            });
        }
        double[] features = featureProvider.extract(trackId, attrs);
        if (features.length != featureProvider.dimension()) {
            throw new IllegalStateException("Feature provider returned " + features.length
                    + " values, expected " + featureProvider.dimension());
        }
        Double rating = store.find(trackId).map(Track::rating).orElse(null);
        Track track = new Track(trackId, features, category, attrs, rating, Instant.now());
        store.put(track);
        LOG.debug("Registered track {} (category={})", trackId, category);
        return track;
    }

    /**
     * Applies a validated rating to a known track.
     *
     * @throws NotFoundException if the track is not registered
     */
    public Track rate(String trackId, double rating, Instant at) {
        validateRating(rating);
        return store.applyRating(trackId, rating, at)
                .orElseThrow(() -> NotFoundException.track(trackId));
    }

    public Track get(String trackId) {
        return store.find(trackId).orElseThrow(() -> NotFoundException.track(trackId));
    }

    public boolean contains(String trackId) {
        return store.find(trackId).isPresent();
    }

    public List<Track> tracks() {
        return store.all();
    }

    public List<String> featureNames() {
        return featureProvider.featureNames();
    }

    public int size() {
        return store.size();
    }

    public static void validateRating(double rating) {
        if (Double.isNaN(rating) || rating < Track.MIN_RATING || rating > Track.MAX_RATING) {
            throw new InvalidInputException("rating", "must be between 1 and 5, got: " + rating);
        }
    }

    private static String stringOrNull(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString();
        return s.isBlank() ? null : s;
    }
}

package com.phillippitts.tastemodel.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable catalog entry: a track, its feature vector and the latest user rating.
 *
 * <p>A new instance replaces the old one whenever a rating arrives or features are
 * re-extracted; {@code updatedAt} marks that moment.
 *
 * @param id            stable track identifier
 * @param featureVector fixed-length numeric representation (defensively copied)
 * @param category      style/category used by the similarity filter (nullable)
 * @param attributes    descriptive attributes such as bpm, key or source pack
 * @param rating        user rating in [1, 5], or {@code null} when unrated
 * @param updatedAt     time of the last mutation
 */
public record Track(
        String id,
        double[] featureVector,
        String category,
        Map<String, Object> attributes,
        Double rating,
        Instant updatedAt
) {

    public static final double MIN_RATING = 1.0;
    public static final double MAX_RATING = 5.0;

    public Track {
        Objects.requireNonNull(id, "Track id must not be null");
        Objects.requireNonNull(featureVector, "Feature vector must not be null");
        featureVector = featureVector.clone();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        if (rating != null && (rating < MIN_RATING || rating > MAX_RATING)) {
            throw new IllegalArgumentException("Rating must be between 1 and 5, got: " + rating);
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    @Override
    public double[] featureVector() {
        return featureVector.clone();
    }

    public boolean isRated() {
        return rating != null;
    }

    public int dimension() {
        return featureVector.length;
    }

    public Track withRating(double newRating, Instant at) {
        return new Track(id, featureVector, category, attributes, newRating, at);
    }

    public Track withFeatures(double[] newVector, Instant at) {
        return new Track(id, newVector, category, attributes, rating, at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Track other)) {
            return false;
        }
        return id.equals(other.id)
                && Arrays.equals(featureVector, other.featureVector)
                && Objects.equals(category, other.category)
                && attributes.equals(other.attributes)
                && Objects.equals(rating, other.rating)
                && updatedAt.equals(other.updatedAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, category, attributes, rating, updatedAt);
        return 31 * result + Arrays.hashCode(featureVector);
    }

    @Override
    public String toString() {
        return "Track[id=" + id + ", dim=" + featureVector.length + ", category=" + category
                + ", rating=" + rating + ", updatedAt=" + updatedAt + "]";
    }
}

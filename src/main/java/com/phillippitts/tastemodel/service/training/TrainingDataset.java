package com.phillippitts.tastemodel.service.training;

import com.phillippitts.tastemodel.domain.Track;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of rated tracks taken at the start of a retrain run.
 *
 * @param modelType    model type being trained
 * @param trackIds     sample identifiers, aligned with {@code features} and {@code ratings}
 * @param features     one feature vector per sample, all of the same length
 * @param ratings      target rating per sample
 * @param featureNames name per feature column
 */
public record TrainingDataset(
        String modelType,
        List<String> trackIds,
        double[][] features,
        double[] ratings,
        List<String> featureNames
) {

    public TrainingDataset {
        Objects.requireNonNull(modelType, "modelType");
        trackIds = List.copyOf(trackIds);
        featureNames = List.copyOf(featureNames);
        if (features.length != ratings.length || features.length != trackIds.size()) {
            throw new IllegalArgumentException("Samples misaligned: " + trackIds.size() + " ids, "
                    + features.length + " vectors, " + ratings.length + " ratings");
        }
        double[][] copy = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            copy[i] = features[i].clone();
            if (i > 0 && copy[i].length != copy[0].length) {
                throw new IllegalArgumentException("Feature vector " + trackIds.get(i) + " has length "
                        + copy[i].length + ", expected " + copy[0].length);
            }
        }
        features = copy;
        ratings = ratings.clone();
    }

    /**
     * Builds a dataset from every rated track; unrated tracks are skipped.
     */
    public static TrainingDataset fromTracks(String modelType, List<Track> tracks, List<String> featureNames) {
        List<Track> rated = new ArrayList<>();
        for (Track t : tracks) {
            if (t.isRated()) {
                rated.add(t);
            }
        }
        List<String> ids = new ArrayList<>(rated.size());
        double[][] x = new double[rated.size()][];
        double[] y = new double[rated.size()];
        for (int i = 0; i < rated.size(); i++) {
            Track t = rated.get(i);
            ids.add(t.id());
            x[i] = t.featureVector();
            y[i] = t.rating();
        }
        return new TrainingDataset(modelType, ids, x, y, featureNames);
    }

    public int size() {
        return ratings.length;
    }

    public int featureDim() {
        return features.length == 0 ? featureNames.size() : features[0].length;
    }

    @Override
    public double[][] features() {
        double[][] copy = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            copy[i] = features[i].clone();
        }
        return copy;
    }

    @Override
    public double[] ratings() {
        return ratings.clone();
    }

    @Override
    public String toString() {
        return "TrainingDataset[" + modelType + ", samples=" + size() + ", dim=" + featureDim() + "]";
    }
}

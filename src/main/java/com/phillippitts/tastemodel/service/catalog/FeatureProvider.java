package com.phillippitts.tastemodel.service.catalog;

import java.util.List;
import java.util.Map;

/**
 * Source of the fixed-length numeric vector that represents a track.
 *
 * <p>Every vector a provider returns has {@link #dimension()} entries, in the order of
 * {@link #featureNames()}.
 */
public interface FeatureProvider {

    List<String> featureNames();

    default int dimension() {
        return featureNames().size();
    }

    /**
     * Derives the feature vector of a track.
     *
     * @param trackId    track being described, for diagnostics
     * @param attributes descriptive attributes (analysis output, tags)
     * @return vector of length {@link #dimension()}
     */
    double[] extract(String trackId, Map<String, Object> attributes);
}

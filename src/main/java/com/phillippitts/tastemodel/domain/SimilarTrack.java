package com.phillippitts.tastemodel.domain;

import java.util.Map;

/**
 * One similarity search hit.
 *
 * @param trackId    neighbour track
 * @param score      similarity, higher is closer
 * @param attributes category and descriptive attributes of the neighbour
 */
public record SimilarTrack(String trackId, double score, Map<String, Object> attributes) {

    public SimilarTrack {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}

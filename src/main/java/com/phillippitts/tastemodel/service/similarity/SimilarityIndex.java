package com.phillippitts.tastemodel.service.similarity;

import com.phillippitts.tastemodel.domain.SimilarTrack;

import java.util.List;

/**
 * Nearest-neighbour search over track feature vectors.
 *
 * <p>Results never contain the query track, hold at most {@code k} entries and are sorted by
 * non-increasing score. The category filter is applied before ranking.
 */
public interface SimilarityIndex {

    /**
     * Finds the tracks closest to {@code trackId}.
     *
     * @param trackId        query track
     * @param k              maximum number of results, positive
     * @param categoryFilter only consider tracks of this category; {@code null} for all
     * @param metric         similarity measure
     * @throws com.phillippitts.tastemodel.exception.NotFoundException if the query track is unknown
     * @throws com.phillippitts.tastemodel.exception.InvalidInputException if {@code k <= 0}
     */
    List<SimilarTrack> findSimilar(String trackId, int k, String categoryFilter, SimilarityMetric metric);

    /** Same as above with the configured default metric. */
    List<SimilarTrack> findSimilar(String trackId, int k, String categoryFilter);
}

package com.phillippitts.tastemodel.presentation.controller;

import com.phillippitts.tastemodel.config.properties.SimilarityProperties;
import com.phillippitts.tastemodel.domain.SimilarTrack;
import com.phillippitts.tastemodel.domain.Track;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.service.catalog.TrackCatalogService;
import com.phillippitts.tastemodel.service.similarity.SimilarityIndex;
import com.phillippitts.tastemodel.service.similarity.SimilarityMetric;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Track registration and "find similar" recommendations.
 */
@RestController
@RequestMapping("/tracks")
class TrackController {

    private final TrackCatalogService catalog;
    private final SimilarityIndex similarityIndex;
    private final SimilarityProperties similarityProperties;

    TrackController(TrackCatalogService catalog, SimilarityIndex similarityIndex,
                    SimilarityProperties similarityProperties) {
        this.catalog = catalog;
        this.similarityIndex = similarityIndex;
        this.similarityProperties = similarityProperties;
    }

    @PostMapping
    ResponseEntity<Track> register(@RequestBody TrackRequest request) {
        Track track = catalog.register(request.id(), request.category(), request.attributes());
        return ResponseEntity.status(HttpStatus.CREATED).body(track);
    }

    @GetMapping("/{id}")
    Track get(@PathVariable String id) {
        return catalog.get(id);
    }

    @GetMapping("/{id}/similar")
    List<SimilarTrack> similar(@PathVariable String id,
                               @RequestParam(required = false) Integer k,
                               @RequestParam(required = false) String category,
                               @RequestParam(required = false) String metric) {
        int limit = k == null ? similarityProperties.getDefaultK() : k;
        if (metric == null || metric.isBlank()) {
            return similarityIndex.findSimilar(id, limit, category);
        }
        return similarityIndex.findSimilar(id, limit, category, parseMetric(metric));
    }

    private static SimilarityMetric parseMetric(String metric) {
        try {
            return SimilarityMetric.parse(metric);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("metric", "expected cosine or euclidean, got: " + metric);
        }
    }

    record TrackRequest(String id, String category, Map<String, Object> attributes) {}
}

package com.phillippitts.tastemodel.service.similarity;

import com.phillippitts.tastemodel.config.properties.PipelineProperties;
import com.phillippitts.tastemodel.config.properties.SimilarityProperties;
import com.phillippitts.tastemodel.domain.SimilarTrack;
import com.phillippitts.tastemodel.domain.Track;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import com.phillippitts.tastemodel.service.catalog.TrackStore;
import com.phillippitts.tastemodel.service.registry.ActiveModelCache;
import com.phillippitts.tastemodel.service.training.PreferenceModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * O(n) {@link SimilarityIndex} that reads the track store on every query, so results always
 * reflect the latest feature vectors. Adequate up to roughly ten thousand tracks.
 *
 * <p>Ties are broken by track id. When a preference model is active, each hit also carries
 * the model's {@code predictedRating}.
 */
@Component
public class BruteForceSimilarityIndex implements SimilarityIndex {

    private static final Logger LOG = LogManager.getLogger(BruteForceSimilarityIndex.class);

    private static final List<String> RESULT_ATTRIBUTES = List.of("source_pack", "style_source", "bpm", "key");

    private static final Comparator<SimilarTrack> RANKING =
            Comparator.comparingDouble(SimilarTrack::score).reversed().thenComparing(SimilarTrack::trackId);

    private final TrackStore store;
    private final SimilarityProperties properties;
    private final ActiveModelCache models;
    private final String modelType;

    public BruteForceSimilarityIndex(TrackStore store, SimilarityProperties properties,
                                     ActiveModelCache models, PipelineProperties pipelineProperties) {
        this.store = Objects.requireNonNull(store, "store");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.models = Objects.requireNonNull(models, "models");
        this.modelType = pipelineProperties.getModelType();
    }

    @Override
    public List<SimilarTrack> findSimilar(String trackId, int k, String categoryFilter) {
        return findSimilar(trackId, k, categoryFilter, properties.getMetric());
    }

    @Override
    public List<SimilarTrack> findSimilar(String trackId, int k, String categoryFilter, SimilarityMetric metric) {
        if (k <= 0) {
            throw new InvalidInputException("k", "must be positive, got: " + k);
        }
        Objects.requireNonNull(metric, "metric");
        int limit = Math.min(k, properties.getMaxK());
        Track query = store.find(trackId).orElseThrow(() -> NotFoundException.track(trackId));
        double[] target = query.featureVector();
        Optional<PreferenceModel> model = preferenceModel();

        List<SimilarTrack> scored = new ArrayList<>();
        for (Track candidate : store.all()) {
            if (candidate.id().equals(trackId)) {
                continue;
            }
            if (categoryFilter != null && !categoryFilter.equals(candidate.category())) {
                continue;
            }
            if (candidate.dimension() != target.length) {
                LOG.debug("Skipping {}: dimension {} != {}", candidate.id(), candidate.dimension(), target.length);
                continue;
            }
            double[] vector = candidate.featureVector();
            scored.add(new SimilarTrack(candidate.id(), metric.score(target, vector),
                    resultAttributes(candidate, vector, model)));
        }
        scored.sort(RANKING);
        List<SimilarTrack> result = scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
        LOG.debug("findSimilar({}, k={}, category={}, metric={}): {} candidates, {} returned",
                trackId, k, categoryFilter, metric, scored.size(), result.size());
        return result;
    }

    private Optional<PreferenceModel> preferenceModel() {
        return models.active(modelType).flatMap(loaded -> {
            try {
                return Optional.of(PreferenceModel.fromBytes(loaded.artifact()));
            } catch (IllegalArgumentException e) {
                LOG.warn("Active {} v{} is not a preference model: {}", modelType, loaded.version(), e.getMessage());
                return Optional.empty();
            }
        });
    }

    private static Map<String, Object> resultAttributes(Track track, double[] vector, Optional<PreferenceModel> model) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (track.category() != null) {
            attrs.put("category", track.category());
        }
        for (String key : RESULT_ATTRIBUTES) {
            Object value = track.attributes().get(key);
            if (value != null) {
                attrs.put(key, value);
            }
        }
        model.filter(m -> m.featureDim() == vector.length)
                .ifPresent(m -> attrs.put("predictedRating", m.predict(vector)));
        return attrs;
    }
}

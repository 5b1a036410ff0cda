package com.phillippitts.tastemodel.config.properties;

import com.phillippitts.tastemodel.service.similarity.SimilarityMetric;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for similarity search.
 */
@Validated
@ConfigurationProperties(prefix = "similarity")
public class SimilarityProperties {

    @Min(1)
    private final int defaultK;

    /** Hard cap on requested neighbours. */
    @Min(1)
    private final int maxK;

    @NotNull
    private final SimilarityMetric metric;

    @ConstructorBinding
    public SimilarityProperties(Integer defaultK, Integer maxK, SimilarityMetric metric) {
        this.defaultK = defaultK == null ? 10 : defaultK;
        this.maxK = maxK == null ? 100 : maxK;
        this.metric = metric == null ? SimilarityMetric.COSINE : metric;
        if (this.defaultK > this.maxK) {
            throw new IllegalArgumentException("similarity.default-k must not exceed similarity.max-k");
        }
    }

    public int getDefaultK() {
        return defaultK;
    }

    public int getMaxK() {
        return maxK;
    }

    public SimilarityMetric getMetric() {
        return metric;
    }
}

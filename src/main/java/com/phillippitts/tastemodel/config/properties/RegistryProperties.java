package com.phillippitts.tastemodel.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the model artifact registry.
 */
@Validated
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    /** Root directory; versions live under {@code <artifact-root>/models/<type>/v<N>}. */
    @NotBlank
    private final String artifactRoot;

    /**
     * Relative error improvement a challenger needs over the incumbent to be judged better (0..1).
     * Ties and smaller gains keep the incumbent.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double promotionMargin;

    @ConstructorBinding
    public RegistryProperties(String artifactRoot, Double promotionMargin) {
        this.artifactRoot = artifactRoot == null || artifactRoot.isBlank() ? "artifacts" : artifactRoot;
        double m = promotionMargin == null ? 0.05 : promotionMargin;
        if (m < 0.0 || m > 1.0) {
            throw new IllegalArgumentException("registry.promotion-margin must be in [0,1]");
        }
        this.promotionMargin = m;
    }

    public String getArtifactRoot() {
        return artifactRoot;
    }

    public double getPromotionMargin() {
        return promotionMargin;
    }
}

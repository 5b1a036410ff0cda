package com.phillippitts.tastemodel.service.catalog;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Builds a 7-dimensional, L2-normalized vector from analysis attributes already attached to
 * a track: bpm/200, energy, brightness/5000, (lufs+60)/60, harmonic ratio, percussive ratio
 * and stereo width. Missing attributes fall back to typical values.
 */
@Component
public class AttributeFeatureProvider implements FeatureProvider {

    private static final Logger LOG = LogManager.getLogger(AttributeFeatureProvider.class);

    private static final List<String> FEATURE_NAMES = List.of(
            "bpm", "energy", "brightness", "lufs", "harmonic_ratio", "percussive_ratio", "stereo_width");

    private static final double DEFAULT_BPM = 120.0;
    private static final double DEFAULT_BRIGHTNESS = 2000.0;
    private static final double DEFAULT_LUFS = -14.0;
    private static final double DEFAULT_RATIO = 0.5;

    @Override
    public List<String> featureNames() {
        return FEATURE_NAMES;
    }

    @Override
    public double[] extract(String trackId, Map<String, Object> attributes) {
        double[] v = {
                number(trackId, attributes, "bpm", DEFAULT_BPM) / 200.0,
                number(trackId, attributes, "energy", 0.0),
                number(trackId, attributes, "brightness", DEFAULT_BRIGHTNESS) / 5000.0,
                (number(trackId, attributes, "lufs", DEFAULT_LUFS) + 60.0) / 60.0,
                number(trackId, attributes, "harmonic_ratio", DEFAULT_RATIO),
                number(trackId, attributes, "percussive_ratio", DEFAULT_RATIO),
                number(trackId, attributes, "stereo_width", 0.0)
        };
        double norm = 0.0;
        for (double x : v) {
            norm += x * x;
        }
        norm = Math.sqrt(norm);
        if (norm > 1e-9) {
            for (int i = 0; i < v.length; i++) {
                v[i] /= norm;
            }
        }
        return v;
    }

    private static double number(String trackId, Map<String, Object> attributes, String key, double fallback) {
        Object raw = attributes.get(key);
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Track {}: attribute {}='{}' is not numeric, using {}", trackId, key, s, fallback);
            }
        }
        return fallback;
    }
}

package com.phillippitts.tastemodel.service.registry;

import com.phillippitts.tastemodel.domain.ModelMetadata;
import com.phillippitts.tastemodel.domain.ModelMetrics;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes {@code metadata.json} / {@code metrics.json}.
 *
 * <p>Keys are snake_case. Timestamps are ISO-8601; offset-less timestamps are read as UTC.
 */
final class RegistryJson {

    private RegistryJson() {}

    static String metadataToJson(ModelMetadata m) {
        JSONObject obj = new JSONObject();
        obj.put("version", m.version());
        obj.put("model_type", m.modelType());
        obj.put("created_at", m.createdAt().toString());
        obj.put("training_samples", m.trainingSamples());
        obj.put("feature_dim", m.featureDim());
        obj.put("hyperparameters", new JSONObject(m.hyperparameters()));
        obj.put("training_duration_ms", m.trainingDurationMs());
        obj.put("notes", m.notes());
        return obj.toString(2);
    }

    static ModelMetadata metadataFromJson(String json) {
        JSONObject obj = new JSONObject(json);
        JSONObject hp = obj.optJSONObject("hyperparameters");
        return new ModelMetadata(
                obj.getInt("version"),
                obj.getString("model_type"),
                parseInstant(obj.getString("created_at")),
                obj.optInt("training_samples", 0),
                obj.optInt("feature_dim", 0),
                hp == null ? Map.of() : withoutNulls(hp.toMap()),
                obj.optLong("training_duration_ms", 0L),
                obj.optString("notes", "")
        );
    }

    static String metricsToJson(ModelMetrics m) {
        JSONObject obj = new JSONObject();
        obj.put("mse", m.mse());
        obj.put("mae", m.mae());
        obj.put("rmse", m.rmse());
        obj.put("r2", m.r2());
        obj.put("val_mse", m.valMse() == null ? JSONObject.NULL : m.valMse());
        obj.put("val_mae", m.valMae() == null ? JSONObject.NULL : m.valMae());
        obj.put("feature_importance", new JSONObject(m.featureImportance()));
        return obj.toString(2);
    }

    static ModelMetrics metricsFromJson(String json) {
        JSONObject obj = new JSONObject(json);
        Map<String, Double> importance = new LinkedHashMap<>();
        JSONObject fi = obj.optJSONObject("feature_importance");
        if (fi != null) {
            for (String key : fi.keySet()) {
                importance.put(key, fi.getDouble(key));
            }
        }
        return new ModelMetrics(
                obj.getDouble("mse"),
                obj.optDouble("mae", 0.0),
                obj.optDouble("rmse", 0.0),
                obj.optDouble("r2", 0.0),
                optionalDouble(obj, "val_mse"),
                optionalDouble(obj, "val_mae"),
                importance
        );
    }

    private static Double optionalDouble(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        return obj.getDouble(key);
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                throw new JSONException("Invalid created_at: " + text, inner);
            }
        }
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (v != null) {
                out.put(k, v);
            }
        });
        return out;
    }
}

package com.phillippitts.tastemodel.service.training;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;

/**
 * Linear preference model: {@code rating = x · w + b}, clamped to the rating scale.
 *
 * <p>Binary layout of {@code model.bin}: magic {@code TMPM}, format version (int), feature
 * dimension (int), bias (double), then one double per weight. Big-endian throughout.
 */
public final class PreferenceModel {

    private static final int MAGIC = 0x544D504D; // "TMPM"
    private static final int FORMAT_VERSION = 1;

    private static final double MIN_RATING = 1.0;
    private static final double MAX_RATING = 5.0;

    private final double[] weights;
    private final double bias;

    public PreferenceModel(double[] weights, double bias) {
        this.weights = weights.clone();
        this.bias = bias;
    }

    public double predict(double[] features) {
        if (features.length != weights.length) {
            throw new IllegalArgumentException("Expected " + weights.length + " features, got " + features.length);
        }
        double score = bias;
        for (int i = 0; i < weights.length; i++) {
            score += weights[i] * features[i];
        }
        return Math.max(MIN_RATING, Math.min(MAX_RATING, score));
    }

    public int featureDim() {
        return weights.length;
    }

    public double[] weights() {
        return weights.clone();
    }

    public double bias() {
        return bias;
    }

    public byte[] toBytes() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(16 + weights.length * Double.BYTES);
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            out.writeInt(MAGIC);
            out.writeInt(FORMAT_VERSION);
            out.writeInt(weights.length);
            out.writeDouble(bias);
            for (double w : weights) {
                out.writeDouble(w);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }

    /**
     * Decodes an artifact written by {@link #toBytes()}.
     *
     * @throws IllegalArgumentException if the bytes are not a preference model
     */
    public static PreferenceModel fromBytes(byte[] bytes) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
            if (in.readInt() != MAGIC) {
                throw new IllegalArgumentException("Not a preference model artifact");
            }
            int format = in.readInt();
            if (format != FORMAT_VERSION) {
                throw new IllegalArgumentException("Unsupported preference model format: " + format);
            }
            int dim = in.readInt();
            if (dim < 0 || dim > (bytes.length - 20) / Double.BYTES) {
                throw new IllegalArgumentException("Invalid feature dimension: " + dim);
            }
            double bias = in.readDouble();
            double[] weights = new double[dim];
            for (int i = 0; i < dim; i++) {
                weights[i] = in.readDouble();
            }
            return new PreferenceModel(weights, bias);
        } catch (IOException e) {
            throw new IllegalArgumentException("Truncated preference model artifact", e);
        }
    }

    @Override
    public String toString() {
        return "PreferenceModel[dim=" + weights.length + ", bias=" + bias + ", w=" + Arrays.toString(weights) + "]";
    }
}

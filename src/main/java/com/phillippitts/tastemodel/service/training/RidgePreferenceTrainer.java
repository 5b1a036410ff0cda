package com.phillippitts.tastemodel.service.training;

import com.phillippitts.tastemodel.config.properties.PipelineProperties;
import com.phillippitts.tastemodel.domain.ModelMetrics;
import com.phillippitts.tastemodel.exception.TrainingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Reference {@link Trainer}: ridge regression of ratings on feature vectors.
 *
 * <p>With {@code Xc} the mean-centred features, the weights solve
 * {@code (XcᵀXc + λI) w = Xcᵀ(y − ȳ)} and the bias is {@code ȳ − w·x̄}.
 * Metrics are computed out-of-fold with k-fold cross-validation (k = min(folds, n)); the
 * stored model is then refitted on every sample.
 */
@Component
public class RidgePreferenceTrainer implements Trainer {

    private static final Logger LOG = LogManager.getLogger(RidgePreferenceTrainer.class);

    static final double DEFAULT_L2 = 1e-2;
    static final int DEFAULT_FOLDS = 5;
    static final long DEFAULT_SEED = 42L;
    static final int MIN_FIT_SAMPLES = 3;

    private final String modelType;
    private final double l2;
    private final int folds;
    private final long seed;

    @Autowired
    public RidgePreferenceTrainer(PipelineProperties properties) {
        this(properties.getModelType(), DEFAULT_L2, DEFAULT_FOLDS, DEFAULT_SEED);
    }

    public RidgePreferenceTrainer(String modelType, double l2, int folds, long seed) {
        if (l2 <= 0.0) {
            throw new IllegalArgumentException("l2 must be positive, got: " + l2);
        }
        if (folds < 2) {
            throw new IllegalArgumentException("folds must be >= 2, got: " + folds);
        }
        this.modelType = modelType;
        this.l2 = l2;
        this.folds = folds;
        this.seed = seed;
    }

    @Override
    public String modelType() {
        return modelType;
    }

    @Override
    public TrainingOutcome train(TrainingDataset dataset) {
        int n = dataset.size();
        if (n < MIN_FIT_SAMPLES) {
            throw new TrainingException("Need at least " + MIN_FIT_SAMPLES + " samples, got " + n, modelType);
        }
        double[][] x = dataset.features();
        double[] y = dataset.ratings();

        int k = Math.min(folds, n);
        double[] oof = crossValidate(x, y, k);
        PreferenceModel model = fit(x, y);

        ModelMetrics metrics = new ModelMetrics(
                mse(y, oof), mae(y, oof), Math.sqrt(mse(y, oof)), r2(y, oof),
                null, null, importance(model, dataset.featureNames()));

        Map<String, Object> hyperparameters = new LinkedHashMap<>();
        hyperparameters.put("algorithm", "ridge");
        hyperparameters.put("l2", l2);
        hyperparameters.put("folds", k);
        hyperparameters.put("seed", seed);

        LOG.info("Trained {} on {} samples (dim={}, folds={}): mse={}, mae={}, r2={}",
                modelType, n, dataset.featureDim(), k, metrics.mse(), metrics.mae(), metrics.r2());
        return new TrainingOutcome(model.toBytes(), metrics, hyperparameters);
    }

    /** Out-of-fold predictions, one per sample. */
    private double[] crossValidate(double[][] x, double[] y, int k) {
        int n = y.length;
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        Collections.shuffle(order, new Random(seed));

        double[] predictions = new double[n];
        for (int fold = 0; fold < k; fold++) {
            List<Integer> train = new ArrayList<>();
            List<Integer> test = new ArrayList<>();
            for (int pos = 0; pos < n; pos++) {
                (pos % k == fold ? test : train).add(order.get(pos));
            }
            double[][] xt = new double[train.size()][];
            double[] yt = new double[train.size()];
            for (int i = 0; i < train.size(); i++) {
                xt[i] = x[train.get(i)];
                yt[i] = y[train.get(i)];
            }
            PreferenceModel foldModel = fit(xt, yt);
            for (int idx : test) {
                predictions[idx] = foldModel.predict(x[idx]);
            }
        }
        return predictions;
    }

    /**
     * Ridge fit on centred features; the bias restores the means so that
     * {@code predict(mean(x)) == mean(y)}.
     */
    PreferenceModel fit(double[][] x, double[] y) {
        int n = y.length;
        int d = x[0].length;
        double yMean = 0.0;
        double[] xMean = new double[d];
        for (int s = 0; s < n; s++) {
            yMean += y[s];
            for (int i = 0; i < d; i++) {
                xMean[i] += x[s][i];
            }
        }
        yMean /= n;
        for (int i = 0; i < d; i++) {
            xMean[i] /= n;
        }

        double[][] a = new double[d][d];
        double[] rhs = new double[d];
        double[] centred = new double[d];
        for (int s = 0; s < n; s++) {
            double residual = y[s] - yMean;
            for (int i = 0; i < d; i++) {
                centred[i] = x[s][i] - xMean[i];
            }
            for (int i = 0; i < d; i++) {
                rhs[i] += centred[i] * residual;
                for (int j = 0; j < d; j++) {
                    a[i][j] += centred[i] * centred[j];
                }
            }
        }
        for (int i = 0; i < d; i++) {
            a[i][i] += l2;
        }
        double[] w = solve(a, rhs);
        double bias = yMean;
        for (int i = 0; i < d; i++) {
            bias -= w[i] * xMean[i];
        }
        return new PreferenceModel(w, bias);
    }

    /** Gaussian elimination with partial pivoting; {@code a} and {@code b} are overwritten. */
    private double[] solve(double[][] a, double[] b) {
        int d = b.length;
        for (int col = 0; col < d; col++) {
            int pivot = col;
            for (int row = col + 1; row < d; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(a[pivot][col]) < 1e-12) {
                throw new TrainingException("Normal equations are singular at column " + col, modelType);
            }
            double[] tmpRow = a[col];
            a[col] = a[pivot];
            a[pivot] = tmpRow;
            double tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;

            for (int row = col + 1; row < d; row++) {
                double factor = a[row][col] / a[col][col];
                b[row] -= factor * b[col];
                for (int j = col; j < d; j++) {
                    a[row][j] -= factor * a[col][j];
                }
            }
        }
        double[] w = new double[d];
        for (int row = d - 1; row >= 0; row--) {
            double sum = b[row];
            for (int j = row + 1; j < d; j++) {
                sum -= a[row][j] * w[j];
            }
            w[row] = sum / a[row][row];
        }
        return w;
    }

    private static Map<String, Double> importance(PreferenceModel model, List<String> names) {
        double[] w = model.weights();
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < w.length; i++) {
            String name = i < names.size() ? names.get(i) : "feature_" + i;
            out.put(name, Math.abs(w[i]));
        }
        return out;
    }

    static double mse(double[] y, double[] p) {
        double sum = 0.0;
        for (int i = 0; i < y.length; i++) {
            double e = y[i] - p[i];
            sum += e * e;
        }
        return sum / y.length;
    }

    static double mae(double[] y, double[] p) {
        double sum = 0.0;
        for (int i = 0; i < y.length; i++) {
            sum += Math.abs(y[i] - p[i]);
        }
        return sum / y.length;
    }

    /** Coefficient of determination; 0 when the ratings have no variance. */
    static double r2(double[] y, double[] p) {
        double mean = 0.0;
        for (double v : y) {
            mean += v;
        }
        mean /= y.length;
        double ssTot = 0.0;
        double ssRes = 0.0;
        for (int i = 0; i < y.length; i++) {
            ssTot += (y[i] - mean) * (y[i] - mean);
            ssRes += (y[i] - p[i]) * (y[i] - p[i]);
        }
        return ssTot == 0.0 ? 0.0 : 1.0 - ssRes / ssTot;
    }
}

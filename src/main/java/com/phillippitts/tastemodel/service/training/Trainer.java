package com.phillippitts.tastemodel.service.training;

/**
 * Pluggable learner: consumes a labeled dataset and returns a serialized model with
 * held-out evaluation metrics.
 *
 * <p>Implementations must be stateless between calls; the coordinator may invoke
 * {@link #train(TrainingDataset)} from any thread of the training executor, but never
 * concurrently for the same model type.
 */
public interface Trainer {

    /**
     * Model type this trainer produces, e.g. {@code "preference"}.
     */
    String modelType();

    /**
     * Trains a model.
     *
     * @param dataset labeled samples, never empty
     * @return serialized artifact plus metrics
     * @throws com.phillippitts.tastemodel.exception.TrainingException if the data cannot be fitted
     */
    TrainingOutcome train(TrainingDataset dataset);
}

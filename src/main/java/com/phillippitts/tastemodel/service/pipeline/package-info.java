/**
 * Retrain pipeline: feedback collection, retrain decisions, evaluation and health-gated promotion.
 *
 * @see com.phillippitts.tastemodel.service.pipeline.RetrainCoordinator
 * @see com.phillippitts.tastemodel.service.pipeline.PipelineStateMachine
 * @since 1.0
 */
package com.phillippitts.tastemodel.service.pipeline;

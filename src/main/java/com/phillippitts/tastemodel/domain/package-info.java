/**
 * Immutable domain records shared across the pipeline.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.tastemodel.domain.Track} - Catalog entry with category, raw
 *       attributes and an optional user rating</li>
 *   <li>{@link com.phillippitts.tastemodel.domain.Feedback} and
 *       {@link com.phillippitts.tastemodel.domain.ControllerEvent} - Inputs collected by the
 *       retrain pipeline</li>
 *   <li>{@link com.phillippitts.tastemodel.domain.ModelMetadata},
 *       {@link com.phillippitts.tastemodel.domain.ModelMetrics} and
 *       {@link com.phillippitts.tastemodel.domain.VersionInfo} - Registry records</li>
 *   <li>{@link com.phillippitts.tastemodel.domain.HealthSample},
 *       {@link com.phillippitts.tastemodel.domain.HealthCheckResult} and
 *       {@link com.phillippitts.tastemodel.domain.HealthStatus} - Serving health</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.tastemodel.domain;

/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.tastemodel.config.ThreadPoolConfig} - Training and probe
 *       executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.tastemodel.config.PipelineConfig} - Retrain coordinator wiring
 *       and optional auto-start</li>
 *   <li>{@link com.phillippitts.tastemodel.config.HealthProbeConfig} - Serving probe selection</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code @ConfigurationProperties} classes</li>
 *   <li>{@code config.logging} - MDC request correlation</li>
 *   <li>{@code config.web} - Serving request statistics filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.tastemodel.config;

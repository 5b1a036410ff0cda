/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.tastemodel.exception.TasteModelException} so callers can handle them
 * uniformly while the REST boundary maps each subtype to its own HTTP status.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.tastemodel.exception.NotFoundException} - Unknown track, model
 *       type or model version</li>
 *   <li>{@link com.phillippitts.tastemodel.exception.InvalidInputException} - Rejected request
 *       values such as a rating outside 1..5</li>
 *   <li>{@link com.phillippitts.tastemodel.exception.CorruptArtifactException} - Stored artifact
 *       bytes do not match their recorded SHA-256 digest</li>
 *   <li>{@link com.phillippitts.tastemodel.exception.ConcurrentTrainingException} - A pipeline
 *       run is already active</li>
 *   <li>{@link com.phillippitts.tastemodel.exception.DeploymentBlockedException} - Promotion
 *       refused because serving health is critical</li>
 *   <li>{@link com.phillippitts.tastemodel.exception.HealthProbeTimeoutException} - Serving
 *       probe did not answer in time</li>
 *   <li>{@link com.phillippitts.tastemodel.exception.RegistryStorageException} and
 *       {@link com.phillippitts.tastemodel.exception.RegistryInvariantException} - Registry I/O
 *       failures and broken on-disk invariants</li>
 *   <li>{@link com.phillippitts.tastemodel.exception.TrainingException} - Trainer failure or
 *       timeout</li>
 * </ul>
 *
 * @see com.phillippitts.tastemodel.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.tastemodel.exception;

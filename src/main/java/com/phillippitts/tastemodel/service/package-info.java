/**
 * Business logic layer.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.registry} - Versioned model artifact storage</li>
 *   <li>{@code service.pipeline} - Retrain coordination and its state machine</li>
 *   <li>{@code service.health} - Serving health scoring, history and alerts</li>
 *   <li>{@code service.similarity} - Nearest-neighbour track search</li>
 *   <li>{@code service.catalog} - Track storage and feature extraction</li>
 *   <li>{@code service.training} - Trainers and the preference model codec</li>
 *   <li>{@code service.events} - Logging listeners for pipeline events</li>
 *   <li>{@code service.metrics} - Micrometer meters</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.tastemodel.service;

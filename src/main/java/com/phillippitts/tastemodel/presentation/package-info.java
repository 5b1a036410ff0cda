/**
 * Presentation layer for REST API endpoints.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - Pipeline, model registry, monitoring and track endpoints</li>
 *   <li>{@code presentation.exception} - Exception to HTTP response mapping</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.tastemodel.presentation;

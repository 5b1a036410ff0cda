/**
 * Global REST exception handling.
 *
 * <p>{@link com.phillippitts.tastemodel.presentation.exception.GlobalExceptionHandler} maps the
 * application exception hierarchy to HTTP status codes and a uniform error body.
 *
 * @since 1.0
 */
package com.phillippitts.tastemodel.presentation.exception;

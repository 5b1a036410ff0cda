/**
 * Versioned model registry.
 *
 * <p>Each model type owns a directory of immutable {@code v<N>} version directories and a
 * {@code latest} pointer file. Artifacts are verified against their SHA-256 digest on every load.
 * All mutations for a type are serialized by a per-type lock.
 *
 * @see com.phillippitts.tastemodel.service.registry.FileSystemModelRegistry
 * @since 1.0
 */
package com.phillippitts.tastemodel.service.registry;

package com.phillippitts.tastemodel.service.registry;

import com.phillippitts.tastemodel.domain.ModelMetadata;

import java.nio.file.Path;

/**
 * Result of {@link ModelRegistry#saveVersion}.
 *
 * @param modelType    model type the version belongs to
 * @param version      assigned version number
 * @param path         version directory
 * @param artifactHash SHA-256 of the stored artifact
 * @param metadata     metadata as stored, with the version stamped in
 */
public record SavedVersion(String modelType, int version, Path path, String artifactHash, ModelMetadata metadata) {}

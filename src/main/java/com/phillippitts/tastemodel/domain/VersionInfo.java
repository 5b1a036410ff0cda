package com.phillippitts.tastemodel.domain;

import java.nio.file.Path;

/**
 * Listing entry for a stored model version.
 */
public record VersionInfo(
        int version,
        Path path,
        ModelMetadata metadata,
        ModelMetrics metrics,
        String artifactHash,
        boolean latest
) {}

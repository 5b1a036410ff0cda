package com.phillippitts.tastemodel.service.registry;

import com.phillippitts.tastemodel.domain.ModelMetadata;
import com.phillippitts.tastemodel.domain.ModelMetrics;
import com.phillippitts.tastemodel.domain.VersionInfo;

import java.util.List;
import java.util.OptionalInt;

/**
 * Durable, versioned store of model artifacts with one {@code latest} pointer per model type.
 *
 * <p>Invariants every implementation keeps:
 * <ul>
 *   <li>Version numbers per model type start at 1 and are assigned as highest existing number + 1,
 *       counting orphaned directories left by failed saves.</li>
 *   <li>{@code latest} only ever names a completely written version.</li>
 *   <li>Writes for one model type never interleave.</li>
 *   <li>Every load re-hashes the artifact and refuses mismatching bytes.</li>
 * </ul>
 *
 * @see FileSystemModelRegistry
 */
public interface ModelRegistry {

    /**
     * Stores a new version as one logical unit. {@code latest} moves only after every file is
     * written, and only when {@code makeLatest} is set.
     *
     * @throws com.phillippitts.tastemodel.exception.RegistryStorageException if a write fails
     */
    SavedVersion saveVersion(String modelType, byte[] artifact, ModelMetadata metadata,
                             ModelMetrics metrics, boolean makeLatest);

    /**
     * Loads and verifies a version.
     *
     * @throws com.phillippitts.tastemodel.exception.NotFoundException if the version (or any latest) is missing
     * @throws com.phillippitts.tastemodel.exception.CorruptArtifactException if the artifact hash does not match
     */
    LoadedModel loadVersion(String modelType, VersionRef ref);

    /** Complete versions, newest first. */
    List<VersionInfo> listVersions(String modelType);

    /** Version {@code latest} points to, if any. */
    OptionalInt latestVersion(String modelType);

    /**
     * Deletes a version. When it was {@code latest}, the pointer moves to the highest remaining
     * version or is removed when none remain.
     *
     * @return false when the version does not exist
     */
    boolean deleteVersion(String modelType, int version);

    /**
     * Re-points {@code latest} at an existing version.
     *
     * @return false when the target does not exist
     */
    boolean rollback(String modelType, int toVersion);

    /**
     * Re-points {@code latest} at a freshly evaluated challenger. Same contract as
     * {@link #rollback(String, int)}; kept separate so logs and callers say what happened.
     */
    boolean promote(String modelType, int version);

    /**
     * Compares two versions by error metric. {@code b} is better only when it improves on
     * {@code a} by at least the configured promotion margin.
     */
    VersionComparison compareVersions(String modelType, int versionA, int versionB);

    /** Model types that have at least one version directory. */
    List<String> modelTypes();
}

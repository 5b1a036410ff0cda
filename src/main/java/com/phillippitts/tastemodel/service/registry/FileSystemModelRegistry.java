package com.phillippitts.tastemodel.service.registry;

import com.phillippitts.tastemodel.config.properties.RegistryProperties;
import com.phillippitts.tastemodel.domain.ModelMetadata;
import com.phillippitts.tastemodel.domain.ModelMetrics;
import com.phillippitts.tastemodel.domain.VersionInfo;
import com.phillippitts.tastemodel.exception.CorruptArtifactException;
import com.phillippitts.tastemodel.exception.InvalidInputException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import com.phillippitts.tastemodel.exception.RegistryInvariantException;
import com.phillippitts.tastemodel.exception.RegistryStorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-system backed {@link ModelRegistry}.
 *
 * <p>Layout:
 * <pre>
 * &lt;artifact-root&gt;/models/&lt;model_type&gt;/v&lt;N&gt;/
 *     model.bin
 *     metadata.json
 *     metrics.json
 *     model.sha256
 * &lt;artifact-root&gt;/models/&lt;model_type&gt;/latest   (contains "v&lt;N&gt;")
 * </pre>
 *
 * <p>The hash file is written last, so a version directory is <em>complete</em> only when all
 * four files exist. Directories left behind by a failed save keep their number reserved but
 * are never listed, loaded through {@code latest}, or accepted as rollback targets.
 *
 * <p><b>Thread Safety:</b> every operation on a model type runs under that type's
 * {@link ReentrantLock}, so saves never interleave and pointer swaps never race.
 */
@Component
public class FileSystemModelRegistry implements ModelRegistry {

    private static final Logger LOG = LogManager.getLogger(FileSystemModelRegistry.class);

    static final String MODELS_DIR = "models";
    static final String MODEL_FILE = "model.bin";
    static final String METADATA_FILE = "metadata.json";
    static final String METRICS_FILE = "metrics.json";
    static final String HASH_FILE = "model.sha256";
    static final String LATEST_POINTER = "latest";

    private static final Pattern VERSION_DIR = Pattern.compile("v(\\d+)");
    private static final Pattern MODEL_TYPE = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

    private final Path modelsRoot;
    private final double promotionMargin;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public FileSystemModelRegistry(RegistryProperties properties) {
        this(Paths.get(properties.getArtifactRoot()), properties.getPromotionMargin());
    }

    public FileSystemModelRegistry(Path artifactRoot, double promotionMargin) {
        Objects.requireNonNull(artifactRoot, "artifactRoot");
        this.modelsRoot = artifactRoot.resolve(MODELS_DIR);
        this.promotionMargin = promotionMargin;
        try {
            Files.createDirectories(modelsRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create registry root " + modelsRoot, e);
        }
        LOG.info("Model registry at {} (promotion margin {})", modelsRoot.toAbsolutePath(), promotionMargin);
    }

    @Override
    public SavedVersion saveVersion(String modelType, byte[] artifact, ModelMetadata metadata,
                                    ModelMetrics metrics, boolean makeLatest) {
        validateModelType(modelType);
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(metrics, "metrics");

        return withLock(modelType, () -> {
            int version = maxVersionNumber(modelType) + 1;
            Path dir = versionDir(modelType, version);
            ModelMetadata stamped = metadata.withVersion(version);
            String hash = ArtifactHasher.sha256Hex(artifact);
            try {
                Files.createDirectories(dir);
                Files.write(dir.resolve(MODEL_FILE), artifact);
                writeString(dir.resolve(METADATA_FILE), RegistryJson.metadataToJson(stamped));
                writeString(dir.resolve(METRICS_FILE), RegistryJson.metricsToJson(metrics));
                writeString(dir.resolve(HASH_FILE), hash);
            } catch (IOException e) {
                LOG.error("Failed to write {} v{} at {}; latest unchanged", modelType, version, dir, e);
                throw new RegistryStorageException(modelType, "Failed to write version v" + version, e);
            }
            if (makeLatest) {
                writePointer(modelType, version);
            }
            LOG.info("Saved {} v{} to {} (latest={}, sha256={})", modelType, version, dir, makeLatest, hash);
            return new SavedVersion(modelType, version, dir, hash, stamped);
        });
    }

    @Override
    public LoadedModel loadVersion(String modelType, VersionRef ref) {
        validateModelType(modelType);
        Objects.requireNonNull(ref, "ref");

        return withLock(modelType, () -> {
            int version;
            if (ref.isLatest()) {
                version = resolveLatest(modelType)
                        .orElseThrow(() -> new NotFoundException("Latest model", modelType));
            } else {
                version = ref.version();
                if (!isComplete(versionDir(modelType, version))) {
                    throw NotFoundException.modelVersion(modelType, version);
                }
            }
            return readVerified(modelType, version);
        });
    }

    @Override
    public List<VersionInfo> listVersions(String modelType) {
        validateModelType(modelType);
        return withLock(modelType, () -> {
            OptionalInt latest = resolveLatest(modelType);
            List<VersionInfo> out = new ArrayList<>();
            for (int version : completeVersions(modelType)) {
                Path dir = versionDir(modelType, version);
                try {
                    out.add(new VersionInfo(
                            version,
                            dir,
                            RegistryJson.metadataFromJson(readString(dir.resolve(METADATA_FILE))),
                            RegistryJson.metricsFromJson(readString(dir.resolve(METRICS_FILE))),
                            readString(dir.resolve(HASH_FILE)).trim(),
                            latest.isPresent() && latest.getAsInt() == version));
                } catch (IOException | JSONException e) {
                    LOG.warn("Skipping unreadable {} v{}: {}", modelType, version, e.toString());
                }
            }
            out.sort(Comparator.comparingInt(VersionInfo::version).reversed());
            return out;
        });
    }

    @Override
    public OptionalInt latestVersion(String modelType) {
        validateModelType(modelType);
        return withLock(modelType, () -> resolveLatest(modelType));
    }

    @Override
    public boolean deleteVersion(String modelType, int version) {
        validateModelType(modelType);
        return withLock(modelType, () -> {
            Path dir = versionDir(modelType, version);
            if (!Files.isDirectory(dir)) {
                LOG.warn("Version not found: {} v{}", modelType, version);
                return false;
            }
            OptionalInt pointer = readPointer(modelType);
            boolean wasLatest = pointer.isPresent() && pointer.getAsInt() == version;

            deleteRecursively(modelType, dir);
            LOG.info("Deleted {} v{}", modelType, version);

            if (wasLatest) {
                List<Integer> remaining = completeVersions(modelType);
                if (remaining.isEmpty()) {
                    clearPointer(modelType);
                    LOG.info("No {} versions remain; latest cleared", modelType);
                } else {
                    int newest = remaining.get(remaining.size() - 1);
                    writePointer(modelType, newest);
                    LOG.info("Re-pointed {} latest to v{} after delete", modelType, newest);
                }
            }
            return true;
        });
    }

    @Override
    public boolean rollback(String modelType, int toVersion) {
        return repoint(modelType, toVersion, "Rolled back");
    }

    @Override
    public boolean promote(String modelType, int version) {
        return repoint(modelType, version, "Promoted");
    }

    @Override
    public VersionComparison compareVersions(String modelType, int versionA, int versionB) {
        validateModelType(modelType);
        return withLock(modelType, () -> {
            ModelMetrics a = readMetrics(modelType, versionA);
            ModelMetrics b = readMetrics(modelType, versionB);
            VersionComparison comparison = VersionComparison.evaluate(
                    modelType, versionA, a, versionB, b, promotionMargin);
            LOG.info("Compared {} v{} (err={}) vs v{} (err={}): improvement={}, better=v{}",
                    modelType, versionA, a.errorMetric(), versionB, b.errorMetric(),
                    comparison.relativeImprovement(), comparison.betterVersion());
            return comparison;
        });
    }

    @Override
    public List<String> modelTypes() {
        try (Stream<Path> children = Files.list(modelsRoot)) {
            return children.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RegistryStorageException("*", "Failed to list model types", e);
        }
    }

    public double getPromotionMargin() {
        return promotionMargin;
    }

    // ---- internals; callers hold the model type lock ----

    private boolean repoint(String modelType, int version, String action) {
        validateModelType(modelType);
        return withLock(modelType, () -> {
            if (!isComplete(versionDir(modelType, version))) {
                LOG.error("{} {} refused: v{} does not exist", action, modelType, version);
                return false;
            }
            writePointer(modelType, version);
            LOG.info("{} {} to v{}", action, modelType, version);
            return true;
        });
    }

    private LoadedModel readVerified(String modelType, int version) {
        Path dir = versionDir(modelType, version);
        try {
            byte[] artifact = Files.readAllBytes(dir.resolve(MODEL_FILE));
            String expected = readString(dir.resolve(HASH_FILE)).trim();
            String actual = ArtifactHasher.sha256Hex(artifact);
            if (!expected.equalsIgnoreCase(actual)) {
                LOG.error("Corrupt artifact {} v{}: expected sha256={}, actual={}", modelType, version, expected, actual);
                throw new CorruptArtifactException(modelType, version, expected, actual);
            }
            ModelMetadata metadata = RegistryJson.metadataFromJson(readString(dir.resolve(METADATA_FILE)));
            ModelMetrics metrics = RegistryJson.metricsFromJson(readString(dir.resolve(METRICS_FILE)));
            LOG.debug("Loaded {} v{} ({} bytes)", modelType, version, artifact.length);
            return new LoadedModel(modelType, version, artifact, metadata, metrics, actual);
        } catch (JSONException e) {
            throw new CorruptArtifactException(modelType, version, e.getMessage());
        } catch (IOException e) {
            throw new RegistryStorageException(modelType, "Failed to read version v" + version, e);
        }
    }

    private ModelMetrics readMetrics(String modelType, int version) {
        Path dir = versionDir(modelType, version);
        if (!isComplete(dir)) {
            throw NotFoundException.modelVersion(modelType, version);
        }
        try {
            return RegistryJson.metricsFromJson(readString(dir.resolve(METRICS_FILE)));
        } catch (JSONException e) {
            throw new CorruptArtifactException(modelType, version, "metrics unreadable: " + e.getMessage());
        } catch (IOException e) {
            throw new RegistryStorageException(modelType, "Failed to read metrics of v" + version, e);
        }
    }

    /** Pointer value, verified to name a complete version. */
    private OptionalInt resolveLatest(String modelType) {
        OptionalInt pointer = readPointer(modelType);
        if (pointer.isPresent() && !isComplete(versionDir(modelType, pointer.getAsInt()))) {
            throw new RegistryInvariantException(
                    "latest pointer of " + modelType + " references missing v" + pointer.getAsInt());
        }
        return pointer;
    }

    private OptionalInt readPointer(String modelType) {
        Path pointer = modelDir(modelType).resolve(LATEST_POINTER);
        try {
            String target;
            if (Files.isSymbolicLink(pointer)) {
                target = Files.readSymbolicLink(pointer).getFileName().toString();
            } else if (Files.isRegularFile(pointer)) {
                target = readString(pointer).trim();
            } else {
                return OptionalInt.empty();
            }
            Matcher m = VERSION_DIR.matcher(target);
            if (!m.matches()) {
                throw new RegistryInvariantException("Malformed latest pointer of " + modelType + ": '" + target + "'");
            }
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (IOException e) {
            throw new RegistryStorageException(modelType, "Failed to read latest pointer", e);
        }
    }

    private void writePointer(String modelType, int version) {
        Path dir = modelDir(modelType);
        Path pointer = dir.resolve(LATEST_POINTER);
        Path tmp = dir.resolve(LATEST_POINTER + ".tmp");
        try {
            writeString(tmp, "v" + version);
            if (Files.isSymbolicLink(pointer)) {
                Files.delete(pointer);
            }
            try {
                Files.move(tmp, pointer, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, pointer, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RegistryStorageException(modelType, "Failed to update latest pointer to v" + version, e);
        }
    }

    private void clearPointer(String modelType) {
        try {
            Files.deleteIfExists(modelDir(modelType).resolve(LATEST_POINTER));
        } catch (IOException e) {
            throw new RegistryStorageException(modelType, "Failed to clear latest pointer", e);
        }
    }

    /** Highest version directory number, complete or not; 0 when none. */
    private int maxVersionNumber(String modelType) {
        return versionNumbers(modelType).stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /** Complete versions in ascending order. */
    private List<Integer> completeVersions(String modelType) {
        return versionNumbers(modelType).stream()
                .filter(v -> isComplete(versionDir(modelType, v)))
                .sorted()
                .toList();
    }

    private List<Integer> versionNumbers(String modelType) {
        Path dir = modelDir(modelType);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Integer> versions = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            children.filter(Files::isDirectory).forEach(p -> {
                Matcher m = VERSION_DIR.matcher(p.getFileName().toString());
                if (m.matches()) {
                    versions.add(Integer.parseInt(m.group(1)));
                }
            });
        } catch (IOException e) {
            throw new RegistryStorageException(modelType, "Failed to scan versions", e);
        }
        return versions;
    }

    private static boolean isComplete(Path versionDir) {
        return Files.isRegularFile(versionDir.resolve(MODEL_FILE))
                && Files.isRegularFile(versionDir.resolve(METADATA_FILE))
                && Files.isRegularFile(versionDir.resolve(METRICS_FILE))
                && Files.isRegularFile(versionDir.resolve(HASH_FILE));
    }

    private void deleteRecursively(String modelType, Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new RegistryStorageException(modelType, "Failed to delete " + dir, e);
        }
    }

    private Path modelDir(String modelType) {
        return modelsRoot.resolve(modelType);
    }

    private Path versionDir(String modelType, int version) {
        return modelDir(modelType).resolve("v" + version);
    }

    private <T> T withLock(String modelType, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(modelType, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static void validateModelType(String modelType) {
        if (modelType == null || !MODEL_TYPE.matcher(modelType).matches()) {
            throw new InvalidInputException("modelType", "must match " + MODEL_TYPE.pattern() + ", got: " + modelType);
        }
    }

    private static void writeString(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    private static String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}

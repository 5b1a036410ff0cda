package com.phillippitts.tastemodel.service.registry;

import com.phillippitts.tastemodel.exception.CorruptArtifactException;
import com.phillippitts.tastemodel.exception.NotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps the model {@code latest} points to in memory, per model type.
 *
 * <p>Every lookup reads the pointer and reloads only when it has moved, so promotions and
 * rollbacks made through any path are picked up on the next call.
 */
@Component
public class ActiveModelCache {

    private static final Logger LOG = LogManager.getLogger(ActiveModelCache.class);

    private final ModelRegistry registry;
    private final ConcurrentMap<String, LoadedModel> active = new ConcurrentHashMap<>();

    public ActiveModelCache(ModelRegistry registry) {
        this.registry = registry;
    }

    /**
     * Model currently served for a type.
     *
     * @return empty when no version is latest, when the latest artifact fails verification,
     *         or when the version was deleted between lookup and load
     */
    public Optional<LoadedModel> active(String modelType) {
        OptionalInt latest = registry.latestVersion(modelType);
        if (latest.isEmpty()) {
            active.remove(modelType);
            return Optional.empty();
        }
        LoadedModel cached = active.get(modelType);
        if (cached != null && cached.version() == latest.getAsInt()) {
            return Optional.of(cached);
        }
        try {
            LoadedModel loaded = registry.loadVersion(modelType, VersionRef.of(latest.getAsInt()));
            active.put(modelType, loaded);
            LOG.info("Active {} model is now v{}", modelType, loaded.version());
            return Optional.of(loaded);
        } catch (CorruptArtifactException e) {
            LOG.error("Refusing to serve {} v{}: {}", modelType, latest.getAsInt(), e.getMessage());
            active.remove(modelType);
            return Optional.empty();
        } catch (NotFoundException e) {
            LOG.warn("{} v{} disappeared before it could be loaded: {}", modelType, latest.getAsInt(), e.getMessage());
            active.remove(modelType);
            return Optional.empty();
        }
    }
}

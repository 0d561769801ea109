package com.marketintel.router.data;

import com.marketintel.router.config.QueryRouterProperties;
import com.marketintel.router.exception.DatasetUnavailableException;
import com.marketintel.router.model.RawDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * In-memory cache of endpoint datasets, keyed by cache key.
 *
 * Sources are tried in order until one holds the key:
 *  1. remote blob store (when enabled)
 *  2. individual file   data/endpoints/{key}.json
 *  3. combined file     data/endpoints/all_endpoints.json
 *  4. legacy exports    {"datasets": {key: ...}}
 *
 * Concurrent loads of the same key share one in-flight future, so each key is
 * read from storage at most once. Failed loads are not cached; the next call
 * retries from the first source. {@link #clear()} drops everything, and a load
 * still running at that moment does not repopulate the cache.
 */
@Service
@Slf4j
public class DatasetCache {

    private static final String LEGACY_CONTAINER = "datasets";

    private final List<DatasetSource> sources;
    private final Executor executor;

    private final Map<String, RawDataset> cached = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<RawDataset>> inflight = new HashMap<>();
    private final Object lock = new Object();
    private long generation;

    @Autowired
    public DatasetCache(QueryRouterProperties properties,
                        BlobDatasetSource blobSource,
                        RawDatasetParser parser,
                        @Qualifier("datasetLoaderExecutor") ExecutorService executor) {
        this(defaultSources(properties, blobSource, parser), executor);
    }

    public DatasetCache(List<DatasetSource> sources, Executor executor) {
        this.sources = List.copyOf(sources);
        this.executor = executor;
    }

    /**
     * Load a dataset, from memory when already cached.
     * The future fails with {@link DatasetUnavailableException} once every source is exhausted.
     */
    public CompletableFuture<RawDataset> load(String cacheKey) {
        RawDataset hit = cached.get(cacheKey);
        if (hit != null) {
            return CompletableFuture.completedFuture(hit);
        }

        synchronized (lock) {
            hit = cached.get(cacheKey);
            if (hit != null) {
                return CompletableFuture.completedFuture(hit);
            }
            CompletableFuture<RawDataset> pending = inflight.get(cacheKey);
            if (pending != null) {
                log.debug("Joining in-flight load of '{}'", cacheKey);
                return pending;
            }

            long startedIn = generation;
            CompletableFuture<RawDataset> tracked = new CompletableFuture<>();
            inflight.put(cacheKey, tracked);

            // bookkeeping happens before callers are released, so a failed key is retryable at once
            CompletableFuture.supplyAsync(() -> loadFromSources(cacheKey), executor)
                    .whenComplete((dataset, error) -> {
                        synchronized (lock) {
                            inflight.remove(cacheKey, tracked);
                            if (error == null && generation == startedIn) {
                                cached.put(cacheKey, dataset);
                            }
                        }
                        if (error == null) {
                            tracked.complete(dataset);
                        } else {
                            tracked.completeExceptionally(
                                    error instanceof CompletionException && error.getCause() != null
                                            ? error.getCause() : error);
                        }
                    });
            return tracked;
        }
    }

    /**
     * Blocking form of {@link #load(String)} that rethrows the load failure itself
     * rather than a CompletionException.
     */
    public RawDataset get(String cacheKey) {
        try {
            return load(cacheKey).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Loading '" + cacheKey + "' failed: " + cause.getMessage(), cause);
        }
    }

    public Optional<RawDataset> peek(String cacheKey) {
        return Optional.ofNullable(cached.get(cacheKey));
    }

    public void clear() {
        synchronized (lock) {
            generation++;
            int dropped = cached.size();
            cached.clear();
            inflight.clear();
            log.info("Dataset cache cleared ({} datasets dropped)", dropped);
        }
    }

    public CacheStatus status() {
        synchronized (lock) {
            List<String> loaded = new ArrayList<>(cached.keySet());
            List<String> loading = new ArrayList<>(inflight.keySet());
            loaded.sort(null);
            loading.sort(null);
            int records = cached.values().stream().mapToInt(RawDataset::size).sum();
            return new CacheStatus(loaded, loading, records);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RawDataset loadFromSources(String cacheKey) {
        List<String> attempted = new ArrayList<>();
        for (DatasetSource source : sources) {
            String description = source.getClass().getSimpleName();
            try {
                description = source.describe(cacheKey);
                Optional<RawDataset> dataset = source.fetch(cacheKey);
                if (dataset.isPresent()) {
                    log.info("Loaded '{}' from {} ({} records)", cacheKey, description, dataset.get().size());
                    return dataset.get();
                }
                log.debug("'{}' not found in {}", cacheKey, description);
                attempted.add(description + " (not found)");
            } catch (Exception e) {
                log.warn("Source {} failed for '{}': {}", description, cacheKey, e.getMessage());
                attempted.add(description + " (" + e.getMessage() + ")");
            }
        }
        log.error("No source holds dataset '{}'", cacheKey);
        throw new DatasetUnavailableException(cacheKey, attempted);
    }

    private static List<DatasetSource> defaultSources(QueryRouterProperties properties,
                                                      BlobDatasetSource blobSource,
                                                      RawDatasetParser parser) {
        QueryRouterProperties.Cache cache = properties.getCache();
        Path dataDir = Path.of(cache.getDataDir());

        List<DatasetSource> sources = new ArrayList<>();
        if (blobSource.isEnabled()) {
            sources.add(blobSource);
        }
        sources.add(new LocalFileDatasetSource(dataDir, cache.getIndividualFilePattern(), parser));
        sources.add(new CombinedFileDatasetSource(dataDir.resolve(cache.getCombinedFile()), null, parser));
        for (String legacy : cache.getLegacyFiles()) {
            sources.add(new CombinedFileDatasetSource(dataDir.resolve(legacy), LEGACY_CONTAINER, parser));
        }
        return sources;
    }
}

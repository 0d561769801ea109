package com.marketintel.router.scheduler;

import com.marketintel.router.catalog.EndpointCatalog;
import com.marketintel.router.config.QueryRouterProperties;
import com.marketintel.router.data.DatasetCache;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Optional dataset preloading.
 *
 * On startup, loads query-router.cache.preload-endpoints when preload-on-startup is set.
 * When query-router.cache.refresh-cron is set, the cache is cleared and warmed again
 * on that schedule so refreshed exports are picked up without a restart.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheWarmer {

    private final DatasetCache datasetCache;
    private final EndpointCatalog catalog;
    private final QueryRouterProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getCache().isPreloadOnStartup()) {
            warm();
        } else {
            log.info("Dataset preload disabled; datasets load on first use");
        }
    }

    @Scheduled(cron = "${query-router.cache.refresh-cron:-}", zone = "UTC")
    public void scheduledRefresh() {
        log.info("Scheduled dataset refresh triggered");
        try {
            datasetCache.clear();
            warm();
        } catch (Exception e) {
            log.error("Scheduled dataset refresh failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Load every configured endpoint in parallel and wait for all of them.
     * A dataset that fails to load is logged and left for the first query to retry.
     *
     * @return number of datasets loaded
     */
    public int warm() {
        List<String> endpoints = properties.getCache().getPreloadEndpoints();
        if (endpoints.isEmpty()) {
            return 0;
        }
        List<CompletableFuture<Boolean>> loads = endpoints.stream()
                .map(endpoint -> catalog.resolve(endpoint).cacheKey())
                .distinct()
                .map(key -> datasetCache.load(key)
                        .thenApply(dataset -> true)
                        .exceptionally(e -> {
                            log.warn("Preload of '{}' failed: {}", key, e.getMessage());
                            return false;
                        }))
                .collect(Collectors.toList());

        int loaded = (int) loads.stream().map(CompletableFuture::join).filter(ok -> ok).count();
        log.info("Preloaded {}/{} datasets", loaded, loads.size());
        return loaded;
    }
}

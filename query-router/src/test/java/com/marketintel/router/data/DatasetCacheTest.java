package com.marketintel.router.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketintel.router.exception.DatasetUnavailableException;
import com.marketintel.router.model.RawDataset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetCacheTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("concurrent loads of one key read storage once")
    void concurrentLoadsShareOneRead() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        StubSource source = new StubSource("blob", Map.of("risk-analysis", dataset(3)), release);
        DatasetCache cache = new DatasetCache(List.of(source), executor);

        List<CompletableFuture<RawDataset>> loads = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            loads.add(cache.load("risk-analysis"));
        }
        assertThat(cache.status().loadingKeys()).containsExactly("risk-analysis");
        release.countDown();

        for (CompletableFuture<RawDataset> load : loads) {
            assertThat(load.get(5, TimeUnit.SECONDS).size()).isEqualTo(3);
        }
        assertThat(source.fetches.get()).isEqualTo(1);

        cache.get("risk-analysis");
        assertThat(source.fetches.get()).isEqualTo(1);
        assertThat(cache.status().loadedKeys()).containsExactly("risk-analysis");
        assertThat(cache.status().totalRecords()).isEqualTo(3);
    }

    @Test
    void sourcesAreTriedInOrder() {
        StubSource blob = new StubSource("blob", Map.of(), null);
        StubSource file = new StubSource("file", Map.of("trend-analysis", dataset(2)), null);
        DatasetCache cache = new DatasetCache(List.of(blob, file), executor);

        assertThat(cache.get("trend-analysis").size()).isEqualTo(2);
        assertThat(blob.fetches.get()).isEqualTo(1);
        assertThat(file.fetches.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("a key escaping the data directory is unavailable, not read")
    void keyOutsideDataDirIsUnavailable(@TempDir Path root) throws IOException {
        Path dataDir = Files.createDirectories(root.resolve("data"));
        Files.writeString(root.resolve("secret.json"), "[{\"ID\": \"x\", \"password\": \"hunter2\"}]");
        LocalFileDatasetSource files = new LocalFileDatasetSource(dataDir, "%s.json",
                new RawDatasetParser(new ObjectMapper()));
        DatasetCache cache = new DatasetCache(List.of(files), executor);

        assertThatThrownBy(() -> cache.get("../secret"))
                .isInstanceOf(DatasetUnavailableException.class)
                .hasMessageContaining("LocalFileDatasetSource")
                .hasMessageContaining("resolves outside");
        assertThat(cache.status().loadedKeys()).isEmpty();
    }

    @Test
    @DisplayName("a failing source is skipped and named in the error")
    void unavailableListsEverySource() {
        StubSource broken = new StubSource("blob", null, null);
        StubSource empty = new StubSource("file", Map.of(), null);
        DatasetCache cache = new DatasetCache(List.of(broken, empty), executor);

        assertThatThrownBy(() -> cache.get("risk-analysis"))
                .isInstanceOf(DatasetUnavailableException.class)
                .hasMessageContaining("blob (connection refused)")
                .hasMessageContaining("file (not found)");
    }

    @Test
    @DisplayName("failures are not cached")
    void failuresAreRetried() {
        StubSource source = new StubSource("file", new ConcurrentHashMap<>(), null);
        DatasetCache cache = new DatasetCache(List.of(source), executor);

        assertThatThrownBy(() -> cache.get("risk-analysis")).isInstanceOf(DatasetUnavailableException.class);
        assertThat(cache.status().loadingKeys()).isEmpty();

        source.datasets.put("risk-analysis", dataset(1));
        assertThat(cache.get("risk-analysis").size()).isEqualTo(1);
        assertThat(source.fetches.get()).isEqualTo(2);
    }

    @Test
    void clearForcesReload() {
        StubSource source = new StubSource("file", Map.of("risk-analysis", dataset(1)), null);
        DatasetCache cache = new DatasetCache(List.of(source), executor);

        cache.get("risk-analysis");
        assertThat(cache.peek("risk-analysis")).isPresent();

        cache.clear();
        assertThat(cache.peek("risk-analysis")).isEmpty();

        cache.get("risk-analysis");
        assertThat(source.fetches.get()).isEqualTo(2);
    }

    private static RawDataset dataset(int size) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            rows.add(Map.of("ID", String.valueOf(i)));
        }
        return RawDataset.of(rows);
    }

    /** In-memory source; a null map makes every fetch fail. */
    private static class StubSource implements DatasetSource {

        final String name;
        final Map<String, RawDataset> datasets;
        final CountDownLatch gate;
        final AtomicInteger fetches = new AtomicInteger();

        StubSource(String name, Map<String, RawDataset> datasets, CountDownLatch gate) {
            this.name = name;
            this.datasets = datasets;
            this.gate = gate;
        }

        @Override
        public Optional<RawDataset> fetch(String cacheKey) throws IOException {
            fetches.incrementAndGet();
            if (gate != null) {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
            }
            if (datasets == null) {
                throw new IOException("connection refused");
            }
            return Optional.ofNullable(datasets.get(cacheKey));
        }

        @Override
        public String describe(String cacheKey) {
            return name;
        }
    }
}

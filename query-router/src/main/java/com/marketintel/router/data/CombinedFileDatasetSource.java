package com.marketintel.router.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketintel.router.model.RawDataset;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * A single file holding many endpoint datasets keyed by cache key.
 *
 * With no container field the key is looked up at the top level
 * ({"strategic-analysis": {...}}); older exports nest them under a
 * container such as {"datasets": {"strategic-analysis": {...}}}.
 * Only the exact key is served, never another endpoint's data.
 */
@Slf4j
public class CombinedFileDatasetSource implements DatasetSource {

    private final Path file;
    private final String containerField;
    private final RawDatasetParser parser;

    public CombinedFileDatasetSource(Path file, String containerField, RawDatasetParser parser) {
        this.file = file;
        this.containerField = containerField;
        this.parser = parser;
    }

    @Override
    public Optional<RawDataset> fetch(String cacheKey) throws IOException {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        JsonNode root = parser.readTree(file);
        JsonNode container = containerField == null ? root : root.path(containerField);
        JsonNode dataset = container.get(cacheKey);
        if (dataset == null || dataset.isNull()) {
            log.debug("{} has no entry for '{}'", file, cacheKey);
            return Optional.empty();
        }
        return Optional.of(parser.parse(dataset));
    }

    @Override
    public String describe(String cacheKey) {
        return containerField == null
                ? "combined file " + file + " [" + cacheKey + "]"
                : "legacy file " + file + " [" + containerField + "." + cacheKey + "]";
    }
}

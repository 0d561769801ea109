package com.marketintel.router.data;

import com.marketintel.router.model.RawDataset;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * One exported file per endpoint, e.g. data/endpoints/strategic-analysis.json
 */
@Slf4j
public class LocalFileDatasetSource implements DatasetSource {

    private final Path dataDir;
    private final String filePattern;
    private final RawDatasetParser parser;

    public LocalFileDatasetSource(Path dataDir, String filePattern, RawDatasetParser parser) {
        this.dataDir = dataDir;
        this.filePattern = filePattern;
        this.parser = parser;
    }

    @Override
    public Optional<RawDataset> fetch(String cacheKey) throws IOException {
        Path file = fileFor(cacheKey);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        log.debug("Reading {}", file);
        return Optional.of(parser.parse(file));
    }

    @Override
    public String describe(String cacheKey) {
        return "file " + fileFor(cacheKey);
    }

    private Path fileFor(String cacheKey) {
        Path root = dataDir.normalize();
        Path file = dataDir.resolve(String.format(filePattern, cacheKey)).normalize();
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("Dataset key '" + cacheKey + "' resolves outside " + root);
        }
        return file;
    }
}

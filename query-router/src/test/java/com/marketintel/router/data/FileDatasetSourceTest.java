package com.marketintel.router.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketintel.router.model.RawDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileDatasetSourceTest {

    private final RawDatasetParser parser = new RawDatasetParser(new ObjectMapper());

    @TempDir
    Path dataDir;

    @Nested
    @DisplayName("individual files")
    class Individual {

        @Test
        void readsFileForKey() throws IOException {
            Files.createDirectories(dataDir.resolve("endpoints"));
            Files.writeString(dataDir.resolve("endpoints/risk-analysis.json"), "[{\"ID\": \"1\"}]");
            LocalFileDatasetSource source = new LocalFileDatasetSource(dataDir, "endpoints/%s.json", parser);

            Optional<RawDataset> dataset = source.fetch("risk-analysis");

            assertThat(dataset).isPresent();
            assertThat(dataset.get().size()).isEqualTo(1);
        }

        @Test
        void missingFileIsEmpty() throws IOException {
            LocalFileDatasetSource source = new LocalFileDatasetSource(dataDir, "endpoints/%s.json", parser);

            assertThat(source.fetch("risk-analysis")).isEmpty();
            assertThat(source.describe("risk-analysis")).startsWith("file ").endsWith("risk-analysis.json");
        }

        @Test
        void keyCannotLeaveDataDir() {
            LocalFileDatasetSource source = new LocalFileDatasetSource(dataDir, "endpoints/%s.json", parser);

            assertThatThrownBy(() -> source.fetch("../../outside"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("resolves outside");
            assertThatThrownBy(() -> source.describe("../../etc/passwd"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("combined and legacy files")
    class Combined {

        @Test
        void topLevelKey() throws IOException {
            Path file = dataDir.resolve("all_endpoints.json");
            Files.writeString(file, "{\"trend-analysis\": {\"results\": [{\"ID\": \"1\"}, {\"ID\": \"2\"}]}}");
            CombinedFileDatasetSource source = new CombinedFileDatasetSource(file, null, parser);

            assertThat(source.fetch("trend-analysis").orElseThrow().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("only the exact key is served, never another endpoint's data")
        void otherKeysAreNotSubstituted() throws IOException {
            Path file = dataDir.resolve("all_endpoints.json");
            Files.writeString(file, "{\"trend-analysis\": [{\"ID\": \"1\"}]}");
            CombinedFileDatasetSource source = new CombinedFileDatasetSource(file, null, parser);

            assertThat(source.fetch("risk-analysis")).isEmpty();
        }

        @Test
        void legacyContainer() throws IOException {
            Path file = dataDir.resolve("microservice-export.json");
            Files.writeString(file, "{\"datasets\": {\"risk-analysis\": [{\"ID\": \"9\"}]}}");
            CombinedFileDatasetSource source = new CombinedFileDatasetSource(file, "datasets", parser);

            assertThat(source.fetch("risk-analysis")).isPresent();
            assertThat(source.describe("risk-analysis")).contains("[datasets.risk-analysis]");
        }

        @Test
        void missingFileIsEmpty() throws IOException {
            CombinedFileDatasetSource source =
                    new CombinedFileDatasetSource(dataDir.resolve("absent.json"), "datasets", parser);

            assertThat(source.fetch("risk-analysis")).isEmpty();
        }
    }
}

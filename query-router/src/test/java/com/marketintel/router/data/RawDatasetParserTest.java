package com.marketintel.router.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketintel.router.model.RawDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RawDatasetParserTest {

    private final RawDatasetParser parser = new RawDatasetParser(new ObjectMapper());

    @Test
    @DisplayName("a bare array is a successful dataset")
    void bareArray() throws Exception {
        RawDataset dataset = parser.parse("[{\"ID\": \"10001\", \"value\": 5}]");

        assertThat(dataset.success()).isTrue();
        assertThat(dataset.size()).isEqualTo(1);
        assertThat(dataset.results().get(0)).containsEntry("ID", "10001");
    }

    @Test
    void envelopeWithModelInfo() throws Exception {
        RawDataset dataset = parser.parse("{\"success\": true,"
                + " \"results\": [{\"ID\": \"1\"}, {\"ID\": \"2\"}],"
                + " \"model_info\": {\"target_variable\": \"strategic_score\"},"
                + " \"feature_importance\": [{\"feature\": \"MEDDI_CY\", \"importance\": 0.42}, {\"importance\": 1}],"
                + " \"summary\": \"two areas\"}");

        assertThat(dataset.size()).isEqualTo(2);
        assertThat(dataset.targetVariable()).isEqualTo("strategic_score");
        assertThat(dataset.featureImportance())
                .containsExactly(new RawDataset.FeatureImportance("MEDDI_CY", 0.42));
        assertThat(dataset.summary()).isEqualTo("two areas");
    }

    @Test
    @DisplayName("reads an exported endpoint file")
    void exportedFile() throws Exception {
        Path file = Path.of(getClass().getResource("/data/endpoints/strategic-analysis.json").toURI());

        RawDataset dataset = parser.parse(file);

        assertThat(dataset.size()).isEqualTo(3);
        assertThat(dataset.targetVariable()).isEqualTo("strategic_score");
        assertThat(dataset.results().get(1)).containsEntry("DESCRIPTION", "11201 (Brooklyn)");
        assertThat(dataset.featureImportance()).hasSize(2);
    }

    @Test
    void successDefaultsToTrueAndFalseIsKept() throws Exception {
        assertThat(parser.parse("{\"results\": []}").success()).isTrue();
        assertThat(parser.parse("{\"success\": false, \"results\": []}").success()).isFalse();
    }

    @Test
    void rejectsObjectsWithoutResults() {
        assertThatThrownBy(() -> parser.parse("{\"data\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'results' array");
    }

    @Test
    void rejectsNonObjectEntries() {
        assertThatThrownBy(() -> parser.parse("[1, 2, 3]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be objects");
    }

    @Test
    void rejectsEmptyDocument() {
        assertThatThrownBy(() -> parser.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

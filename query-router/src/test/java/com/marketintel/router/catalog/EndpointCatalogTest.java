package com.marketintel.router.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointCatalogTest {

    private final EndpointCatalog catalog = new EndpointCatalog();

    @Test
    void aliasesShareCacheKey() {
        assertThat(catalog.resolve("/brand-analysis").cacheKey()).isEqualTo("competitive-analysis");
        assertThat(catalog.resolve("/market-sizing").cacheKey()).isEqualTo("segment-profiling");
        assertThat(catalog.resolve("/real-estate-analysis").cacheKey()).isEqualTo("spatial-clusters");
    }

    @Test
    void detectionAndModelingEndpointsRegistered() {
        assertThat(catalog.find("/anomaly-detection").orElseThrow().targetVariable()).isEqualTo("anomaly_score");
        assertThat(catalog.find("/outlier-detection").orElseThrow().cacheKey()).isEqualTo("outlier-detection");
        assertThat(catalog.find("/predictive-modeling").orElseThrow().targetVariable()).isEqualTo("prediction_score");
        assertThat(catalog.find("/scenario-analysis").orElseThrow().cacheKey()).isEqualTo("scenario-analysis");
        assertThat(catalog.find("/threshold-analysis").orElseThrow().cacheKey()).isEqualTo("threshold-analysis");
    }

    @ParameterizedTest
    @ValueSource(strings = {"/../../secret", "../x", "/a/b", "/Strategic", "/x.json", "/-lead", "", "/"})
    void unknownEndpointMustBeSlug(String path) {
        assertThatThrownBy(() -> catalog.resolve(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid endpoint");
    }

    @Test
    void pathsAreNormalised() {
        assertThat(catalog.resolve(" risk-analysis ").path()).isEqualTo("/risk-analysis");
        assertThat(catalog.contains("trend-analysis")).isTrue();
    }

    @Test
    void unknownEndpointResolvesAdHoc() {
        EndpointDefinition definition = catalog.resolve("/store-traffic");

        assertThat(catalog.find("/store-traffic")).isEmpty();
        assertThat(definition.cacheKey()).isEqualTo("store-traffic");
        assertThat(definition.type()).isEqualTo("store_traffic");
    }

    @Test
    void everyScoredEndpointIsInCatalog() {
        new EndpointKeywordTable(catalog).profiles()
                .forEach(profile -> assertThat(catalog.contains(profile.endpoint())).isTrue());
    }
}

package com.marketintel.router.service;

import com.marketintel.router.catalog.EndpointCatalog;
import com.marketintel.router.catalog.EndpointDefinition;
import com.marketintel.router.data.DatasetCache;
import com.marketintel.router.exception.AnalysisPipelineException;
import com.marketintel.router.exception.ProcessingFailedException;
import com.marketintel.router.exception.SchemaValidationException;
import com.marketintel.router.geo.GeoFilter;
import com.marketintel.router.geo.GeoFilterResult;
import com.marketintel.router.model.AnalysisRequest;
import com.marketintel.router.model.AnalysisResult;
import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.CanonicalRecord;
import com.marketintel.router.model.Distribution;
import com.marketintel.router.model.Patterns;
import com.marketintel.router.model.RawDataset;
import com.marketintel.router.model.ResultStatus;
import com.marketintel.router.model.RouteDecision;
import com.marketintel.router.processing.DataProcessor;
import com.marketintel.router.processing.ProcessedDataset;
import com.marketintel.router.processing.ProcessingContext;
import com.marketintel.router.processing.ProcessorRegistry;
import com.marketintel.router.processing.RecordFieldExtractor;
import com.marketintel.router.routing.EndpointRouter;
import com.marketintel.router.routing.FieldKeywordIndex;
import com.marketintel.router.stats.StatisticsEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one query through the pipeline:
 *
 *   route → load → validate → geographic / area selection → process → statistics → narrative
 *
 * Validation and processing failures are fatal for the query and never replaced
 * with another endpoint's data. A selection that matches nothing is a
 * {@link ResultStatus#NO_DATA_FOR_SELECTION} result, not an error.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalysisPipelineService {

    private final EndpointRouter router;
    private final EndpointCatalog catalog;
    private final DatasetCache datasetCache;
    private final ProcessorRegistry processorRegistry;
    private final FieldKeywordIndex fieldIndex;
    private final GeoFilter geoFilter;
    private final StatisticsEngine statisticsEngine;
    private final NarrativeContextFormatter narrativeFormatter;

    public AnalysisResult analyze(AnalysisRequest request) {
        if (request == null || request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        String query = request.query().trim();

        RouteDecision decision = router.route(query, request.endpoint());
        if (decision.isMultiEndpoint()) {
            return AnalysisResult.builder()
                    .status(ResultStatus.MULTI_ENDPOINT_REQUIRED)
                    .routing(decision.outcome())
                    .candidates(decision.scores())
                    .geographicEntities(geoFilter.resolve(query, List.of()).entities())
                    .build();
        }

        EndpointDefinition endpoint = catalog.resolve(decision.endpoint());
        RawDataset dataset = datasetCache.get(endpoint.cacheKey());

        DataProcessor processor = processorRegistry.get(endpoint.path());
        if (!processor.validate(dataset)) {
            log.error("Dataset '{}' failed {} validation", endpoint.cacheKey(), processor.name());
            throw new SchemaValidationException(endpoint.path(), processor.name());
        }

        GeoFilterResult geo = geoFilter.resolve(query, dataset.results());
        List<Map<String, Object>> selected = selectAreas(geo.filteredRecords(), request.areaIds());

        if (selected.isEmpty() && dataset.size() > 0) {
            log.info("Selection {} / {} matched none of {} records for {}",
                    geo.entities(), request.areaIds(), dataset.size(), endpoint.path());
            return emptySelection(endpoint, decision, geo, request.areaIds());
        }

        ProcessingContext context = new ProcessingContext(endpoint, query, fieldIndex.mentionedBrands(query));
        ProcessedDataset processed;
        AnalysisStatistics statistics;
        try {
            processed = processor.process(dataset.withResults(selected), context);
            AnalysisStatistics.AnalysisStatisticsBuilder builder = statisticsEngine.summarize(processed.records());
            processor.contributeStatistics(processed.records(), builder);
            statistics = builder.build();
        } catch (AnalysisPipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} failed for {}: {}", processor.name(), endpoint.path(), e.getMessage(), e);
            throw new ProcessingFailedException(endpoint.path(), processor.name(), e);
        }

        List<CanonicalRecord> records = processed.records();
        Distribution distribution = statisticsEngine.computeDistribution(records);
        Patterns patterns = statisticsEngine.detectPatterns(records);

        Map<String, Object> metadata = new LinkedHashMap<>(processed.metadata());
        metadata.put("processor", processor.name());
        metadata.put("selection", selectionBlock(geo, request.areaIds(), records.size()));
        if (dataset.featureImportance() != null && !dataset.featureImportance().isEmpty()) {
            metadata.put("featureImportance", dataset.featureImportance());
        }
        if (dataset.summary() != null) {
            metadata.put("modelSummary", dataset.summary());
        }

        log.info("Analysis of '{}' via {} → {} records (mean {})",
                query, endpoint.path(), records.size(), String.format("%.2f", statistics.getMean()));

        return AnalysisResult.builder()
                .endpoint(endpoint.path())
                .type(processed.type())
                .status(ResultStatus.COMPLETE)
                .routing(decision.outcome())
                .targetVariable(processed.targetVariable())
                .records(records)
                .statistics(statistics)
                .distribution(distribution)
                .patterns(patterns)
                .metadata(metadata)
                .geographicEntities(geo.entities())
                .narrativeContext(narrativeFormatter.format(endpoint.path(), records,
                        statisticsEngine.computeBasicStats(records), distribution, patterns))
                .build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** Null area ids means no spatial selection; an empty list selects nothing. */
    private List<Map<String, Object>> selectAreas(List<Map<String, Object>> rows, List<String> areaIds) {
        if (areaIds == null) {
            return rows;
        }
        Set<String> wanted = new HashSet<>(areaIds);
        return rows.stream()
                .filter(row -> RecordFieldExtractor.areaId(row).map(wanted::contains).orElse(false))
                .collect(Collectors.toList());
    }

    private AnalysisResult emptySelection(EndpointDefinition endpoint, RouteDecision decision,
                                          GeoFilterResult geo, List<String> areaIds) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("selection", selectionBlock(geo, areaIds, 0));
        return AnalysisResult.builder()
                .endpoint(endpoint.path())
                .type(endpoint.type())
                .status(ResultStatus.NO_DATA_FOR_SELECTION)
                .routing(decision.outcome())
                .targetVariable(endpoint.targetVariable())
                .records(List.of())
                .statistics(statisticsEngine.summarize(List.of()).build())
                .distribution(Distribution.empty())
                .patterns(Patterns.empty())
                .metadata(metadata)
                .geographicEntities(geo.entities())
                .build();
    }

    private static Map<String, Object> selectionBlock(GeoFilterResult geo, List<String> areaIds, int kept) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("entities", geo.entities());
        block.put("totalRecords", geo.totalRecords());
        block.put("keptRecords", kept);
        if (areaIds != null) {
            block.put("requestedAreaIds", areaIds.size());
        }
        return block;
    }
}

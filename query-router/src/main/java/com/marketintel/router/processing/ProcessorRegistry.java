package com.marketintel.router.processing;

import com.marketintel.router.routing.FieldKeywordIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Endpoint → processor table. Endpoints without an entry use the default processor.
 */
@Component
@Slf4j
public class ProcessorRegistry {

    public static final String DEFAULT = "default";

    private final Map<String, DataProcessor> processors = new LinkedHashMap<>();

    public ProcessorRegistry(FieldKeywordIndex fieldIndex) {
        DataProcessor core = new CoreAnalysisProcessor();
        DataProcessor competitive = new CompetitiveAnalysisProcessor();
        DataProcessor segment = new SegmentProfilingProcessor();
        DataProcessor cluster = new SpatialClusterProcessor();

        register(DEFAULT,                 core);
        register("/analyze",              core);
        register("/strategic-analysis",   new StrategicAnalysisProcessor());
        register("/competitive-analysis", competitive);
        register("/brand-analysis",       competitive);
        register("/brand-difference",     new BrandDifferenceProcessor(fieldIndex));
        register("/demographic-insights", new DemographicInsightsProcessor());
        register("/customer-profile",     new CustomerProfileProcessor());
        register("/comparative-analysis", new ComparativeAnalysisProcessor());
        register("/trend-analysis",       new TrendAnalysisProcessor());
        register("/correlation-analysis", new CorrelationAnalysisProcessor());
        register("/spatial-clusters",     cluster);
        register("/real-estate-analysis", cluster);
        register("/feature-interactions", new FeatureInteractionProcessor());
        register("/risk-analysis",        new RiskAnalysisProcessor());
        register("/segment-profiling",    segment);
        register("/market-sizing",        segment);
        register("/anomaly-detection",    core);
        register("/outlier-detection",    core);
        register("/predictive-modeling",  core);
        register("/scenario-analysis",    core);
        register("/threshold-analysis",   core);
    }

    private void register(String endpoint, DataProcessor processor) {
        processors.put(endpoint, processor);
    }

    public DataProcessor get(String endpoint) {
        DataProcessor processor = processors.get(endpoint);
        if (processor == null) {
            log.debug("No processor registered for {}, using default", endpoint);
            return processors.get(DEFAULT);
        }
        return processor;
    }

    public boolean hasDedicatedProcessor(String endpoint) {
        return !DEFAULT.equals(endpoint) && processors.containsKey(endpoint);
    }
}

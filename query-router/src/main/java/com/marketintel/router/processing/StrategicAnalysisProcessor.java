package com.marketintel.router.processing;

import com.marketintel.router.model.CanonicalRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class StrategicAnalysisProcessor extends AbstractRecordProcessor {

    private static final List<String> SCORE_FIELDS = List.of("strategic_value_score", "strategic_analysis_score");
    private static final int TOP_MARKETS = 5;

    public StrategicAnalysisProcessor() {
        super("strategic", SCORE_FIELDS, List.of("strategic_score", "strategic_value_score", "strategic_analysis_score"));
    }

    @Override
    protected void describe(List<CanonicalRecord> ranked, ProcessingContext context, Map<String, Object> metadata) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("topMarkets", ranked.stream()
                .limit(TOP_MARKETS)
                .map(CanonicalRecord::getAreaName)
                .collect(Collectors.toList()));
        metadata.put("strategicAnalysis", block);
    }
}

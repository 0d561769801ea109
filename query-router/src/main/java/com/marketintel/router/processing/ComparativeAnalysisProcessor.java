package com.marketintel.router.processing;

import com.marketintel.router.model.CanonicalRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Area-by-area comparison. The city in an area name like "10001 (New York)"
 * becomes the category, and metadata carries per-city averages.
 */
public class ComparativeAnalysisProcessor extends AbstractRecordProcessor {

    private static final Pattern PARENTHETICAL = Pattern.compile("\\(([^)]+)\\)");
    private static final List<String> CITY_FIELDS = List.of("city", "CITY");

    public ComparativeAnalysisProcessor() {
        super("comparative",
                List.of("comparative_score", "comparative_analysis_score"),
                List.of("comparison_score", "comparative_score", "comparative_analysis_score"));
    }

    @Override
    protected CanonicalRecord toRecord(Map<String, Object> raw, int index, ProcessingContext context) {
        CanonicalRecord record = super.toRecord(raw, index, context);
        record.setCategory(RecordFieldExtractor.firstText(raw, CITY_FIELDS)
                .orElseGet(() -> cityOf(record.getAreaName())));
        return record;
    }

    @Override
    protected void describe(List<CanonicalRecord> ranked, ProcessingContext context, Map<String, Object> metadata) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (CanonicalRecord record : ranked) {
            if (record.getCategory() == null) continue;
            double[] acc = sums.computeIfAbsent(record.getCategory(), k -> new double[2]);
            acc[0] += record.getValue();
            acc[1]++;
        }
        Map<String, Object> cities = new LinkedHashMap<>();
        sums.forEach((city, acc) -> cities.put(city, Map.of("count", (int) acc[1], "avgScore", acc[0] / acc[1])));
        metadata.put("comparativeAnalysis", Map.of("cities", cities));
    }

    static String cityOf(String areaName) {
        if (areaName == null) return null;
        Matcher m = PARENTHETICAL.matcher(areaName);
        return m.find() ? m.group(1).trim() : null;
    }
}

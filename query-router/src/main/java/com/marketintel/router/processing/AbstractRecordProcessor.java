package com.marketintel.router.processing;

import com.marketintel.router.model.CanonicalRecord;
import com.marketintel.router.model.RawDataset;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Shared conversion of raw result rows into ranked canonical records.
 *
 * Subclasses name their score fields and the fields validation requires, and
 * override {@link #toRecord} or {@link #buildRecords} when a family needs more
 * than the primary metric. Ranking is not overridable.
 */
public abstract class AbstractRecordProcessor implements DataProcessor {

    private static final List<String> GENERIC_SCORE_FIELDS = List.of("value", "score");

    private final String name;
    private final List<String> scoreFields;
    private final List<String> requiredFields;

    /**
     * @param scoreFields    fallbacks for the primary metric after the endpoint's target variable
     * @param requiredFields validation passes when any record holds any of these; empty means no field check
     */
    protected AbstractRecordProcessor(String name, List<String> scoreFields, List<String> requiredFields) {
        this.name = name;
        this.scoreFields = List.copyOf(scoreFields);
        this.requiredFields = List.copyOf(requiredFields);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean validate(RawDataset dataset) {
        if (dataset == null || !Boolean.TRUE.equals(dataset.success()) || dataset.results() == null) {
            return false;
        }
        if (requiredFields.isEmpty() || dataset.results().isEmpty()) {
            return true;
        }
        return dataset.results().stream()
                .anyMatch(row -> row != null && requiredFields.stream().anyMatch(row::containsKey));
    }

    @Override
    public ProcessedDataset process(RawDataset dataset, ProcessingContext context) {
        List<CanonicalRecord> ranked = rankRecords(buildRecords(dataset, context));
        Map<String, Object> metadata = new LinkedHashMap<>();
        describe(ranked, context, metadata);
        return new ProcessedDataset(context.endpoint().type(), ranked, targetVariable(dataset, context), metadata);
    }

    // ── Extension points ─────────────────────────────────────────────────────

    protected List<CanonicalRecord> buildRecords(RawDataset dataset, ProcessingContext context) {
        List<Map<String, Object>> rows = dataset.results();
        List<CanonicalRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            records.add(toRecord(rows.get(i), i, context));
        }
        return records;
    }

    protected CanonicalRecord toRecord(Map<String, Object> raw, int index, ProcessingContext context) {
        String id = RecordFieldExtractor.areaId(raw, index);
        return CanonicalRecord.builder()
                .areaId(id)
                .areaName(RecordFieldExtractor.areaName(raw, id))
                .value(primaryValue(raw, context))
                .coordinates(RecordFieldExtractor.coordinates(raw))
                .properties(new LinkedHashMap<>(raw))
                .shapValues(RecordFieldExtractor.shapValues(raw))
                .build();
    }

    /** Adds endpoint-family blocks to the result metadata. */
    protected void describe(List<CanonicalRecord> ranked, ProcessingContext context, Map<String, Object> metadata) {
    }

    protected String targetVariable(RawDataset dataset, ProcessingContext context) {
        return context.endpoint().targetVariable();
    }

    // ── Shared helpers ───────────────────────────────────────────────────────

    /** Primary metric: target variable, then this family's score fields, then value/score. 0 when none. */
    protected double primaryValue(Map<String, Object> raw, ProcessingContext context) {
        return RecordFieldExtractor.numeric(raw, primaryCandidates(context));
    }

    protected List<String> primaryCandidates(ProcessingContext context) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(context.endpoint().targetVariable());
        candidates.addAll(scoreFields);
        candidates.addAll(GENERIC_SCORE_FIELDS);
        return new ArrayList<>(candidates);
    }

    /** Mean of the first usable candidate field across the records that have one. */
    protected static OptionalDouble average(List<CanonicalRecord> records, List<String> fields) {
        return records.stream()
                .map(r -> RecordFieldExtractor.firstNumber(r.getProperties(), fields))
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .average();
    }

    protected static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    /**
     * Sort by value descending and assign ranks 1..n. Equal values keep their
     * input order, so ranks are always a permutation of 1..n.
     */
    protected final List<CanonicalRecord> rankRecords(List<CanonicalRecord> records) {
        List<CanonicalRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingDouble(CanonicalRecord::getValue).reversed());
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).setRank(i + 1);
        }
        return sorted;
    }
}

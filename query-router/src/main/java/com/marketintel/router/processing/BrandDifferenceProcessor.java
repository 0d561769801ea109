package com.marketintel.router.processing;

import com.marketintel.router.model.CanonicalRecord;
import com.marketintel.router.model.RawDataset;
import com.marketintel.router.routing.FieldKeywordIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Market share gap between two brands, in percentage points.
 *
 * The pair comes from the query when it names two brands. With one named
 * brand it is compared against the first other brand present in the data;
 * with none, the first two brands present in the data are used.
 *
 * "nike vs adidas" on a row with nike 32.1 and adidas 18.4 → value 13.7
 */
@Slf4j
public class BrandDifferenceProcessor extends AbstractRecordProcessor {

    private final FieldKeywordIndex fieldIndex;

    public BrandDifferenceProcessor(FieldKeywordIndex fieldIndex) {
        super("brand-difference", List.of(), allShareFields(fieldIndex));
        this.fieldIndex = fieldIndex;
    }

    @Override
    protected List<CanonicalRecord> buildRecords(RawDataset dataset, ProcessingContext context) {
        if (dataset.results().isEmpty()) {
            return new ArrayList<>();
        }
        BrandPair pair = resolvePair(dataset.results(), context.extractedBrands());
        log.debug("Brand difference: {} vs {}", pair.first(), pair.second());

        List<Map<String, Object>> rows = dataset.results();
        List<CanonicalRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> raw = rows.get(i);
            CanonicalRecord record = toRecord(raw, i, context);
            double first = share(raw, pair.first(), record.getAreaId());
            double second = share(raw, pair.second(), record.getAreaId());
            double difference = first - second;
            record.setValue(difference);
            record.setCategory(difference > 0 ? pair.first() + "_leads"
                    : difference < 0 ? pair.second() + "_leads" : "parity");
            record.getProperties().put("brand_difference_score", difference);
            records.add(record);
        }
        return records;
    }

    @Override
    public ProcessedDataset process(RawDataset dataset, ProcessingContext context) {
        ProcessedDataset processed = super.process(dataset, context);
        if (processed.records().isEmpty()) {
            return processed;
        }
        BrandPair pair = resolvePair(dataset.results(), context.extractedBrands());
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("brands", List.of(pair.first(), pair.second()));
        block.put("fields", List.of(fieldIndex.brandShareFields(pair.first()), fieldIndex.brandShareFields(pair.second())));
        block.put("leadingArea", processed.records().get(0).getAreaName());
        processed.metadata().put("brandComparison", block);
        return processed;
    }

    // ── Brand resolution ─────────────────────────────────────────────────────

    BrandPair resolvePair(List<Map<String, Object>> rows, List<String> extractedBrands) {
        List<String> named = extractedBrands == null ? List.of() : extractedBrands;
        if (named.size() >= 2) {
            return new BrandPair(named.get(0), named.get(1));
        }

        List<String> present = fieldIndex.brandNames().stream()
                .filter(brand -> rows.stream().anyMatch(row -> hasShare(row, brand)))
                .collect(Collectors.toList());

        if (named.size() == 1) {
            String brand = named.get(0);
            String other = present.stream().filter(b -> !b.equals(brand)).findFirst()
                    .orElseThrow(() -> new IllegalStateException("No second brand in the data to compare " + brand + " with"));
            return new BrandPair(brand, other);
        }
        if (present.size() < 2) {
            throw new IllegalStateException("Need two brands with market share fields, found " + present);
        }
        return new BrandPair(present.get(0), present.get(1));
    }

    private double share(Map<String, Object> raw, String brand, String areaId) {
        OptionalDouble value = RecordFieldExtractor.firstNumber(raw, fieldIndex.brandShareFields(brand));
        if (value.isEmpty()) {
            throw new IllegalStateException("Record " + areaId + " has no market share for " + brand);
        }
        return value.getAsDouble();
    }

    private boolean hasShare(Map<String, Object> row, String brand) {
        return RecordFieldExtractor.firstNumber(row, fieldIndex.brandShareFields(brand)).isPresent();
    }

    private static List<String> allShareFields(FieldKeywordIndex index) {
        return index.brandNames().stream()
                .flatMap(brand -> index.brandShareFields(brand).stream())
                .collect(Collectors.toList());
    }

    record BrandPair(String first, String second) {}
}

package com.marketintel.router.processing;

import com.marketintel.router.model.CanonicalRecord;

import java.util.List;
import java.util.Map;

/**
 * Segment profiling and market sizing share one export; the segment label becomes the category.
 */
public class SegmentProfilingProcessor extends AbstractRecordProcessor {

    private static final List<String> SEGMENT_FIELDS = List.of("segment", "segment_name", "segment_label");

    public SegmentProfilingProcessor() {
        super("segment",
                List.of("segment_score", "segment_profiling_score", "market_sizing_score", "market_size_score"),
                List.of("segment_score", "segment_profiling_score", "market_sizing_score", "market_size_score"));
    }

    @Override
    protected CanonicalRecord toRecord(Map<String, Object> raw, int index, ProcessingContext context) {
        CanonicalRecord record = super.toRecord(raw, index, context);
        RecordFieldExtractor.firstText(raw, SEGMENT_FIELDS).ifPresent(record::setCategory);
        return record;
    }
}

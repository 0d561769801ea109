package com.marketintel.router.processing;

import com.marketintel.router.model.CanonicalRecord;

import java.util.List;
import java.util.Map;

/**
 * Customer fit per area. The persona label, when exported, becomes the record category.
 */
public class CustomerProfileProcessor extends AbstractRecordProcessor {

    private static final List<String> PERSONA_FIELDS = List.of("persona", "customer_persona", "persona_type");

    public CustomerProfileProcessor() {
        super("customer-profile",
                List.of("customer_profile_score", "persona_score"),
                List.of("customer_profile_score", "persona_score"));
    }

    @Override
    protected CanonicalRecord toRecord(Map<String, Object> raw, int index, ProcessingContext context) {
        CanonicalRecord record = super.toRecord(raw, index, context);
        RecordFieldExtractor.firstText(raw, PERSONA_FIELDS).ifPresent(record::setCategory);
        return record;
    }
}

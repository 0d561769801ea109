package com.marketintel.router.processing;

import java.util.List;

/**
 * Generic processor: primary metric from the target variable or a value/score
 * field. Serves /analyze and every endpoint without a registration of its own.
 */
public class CoreAnalysisProcessor extends AbstractRecordProcessor {

    public CoreAnalysisProcessor() {
        super("core", List.of("analysis_score"), List.of());
    }
}

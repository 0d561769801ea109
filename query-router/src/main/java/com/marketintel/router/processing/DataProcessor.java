package com.marketintel.router.processing;

import com.marketintel.router.model.AnalysisStatistics;
import com.marketintel.router.model.CanonicalRecord;
import com.marketintel.router.model.RawDataset;

import java.util.List;

/**
 * Converts one endpoint family's raw dataset into ranked canonical records.
 */
public interface DataProcessor {

    String name();

    /**
     * Structural check of the raw dataset. Returns false, never throws, when the
     * success flag is not true, results are missing, or the family's fields are absent.
     */
    boolean validate(RawDataset dataset);

    /**
     * Produce the full ranked record set or throw. Never returns a partial set.
     */
    ProcessedDataset process(RawDataset dataset, ProcessingContext context);

    /**
     * Fill the family-specific statistics fields. Core fields are set by the caller.
     */
    default void contributeStatistics(List<CanonicalRecord> records,
                                      AnalysisStatistics.AnalysisStatisticsBuilder statistics) {
    }
}

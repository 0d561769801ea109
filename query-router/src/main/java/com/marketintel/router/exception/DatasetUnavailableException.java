package com.marketintel.router.exception;

import lombok.Getter;

import java.util.List;

/**
 * No source could supply the dataset for a cache key.
 */
@Getter
public class DatasetUnavailableException extends AnalysisPipelineException {

    private final String cacheKey;
    private final List<String> attemptedSources;

    public DatasetUnavailableException(String cacheKey, List<String> attemptedSources) {
        super(ErrorKind.DATASET_UNAVAILABLE, cacheKey,
                "No dataset available for '" + cacheKey + "'. Tried: " + String.join("; ", attemptedSources));
        this.cacheKey = cacheKey;
        this.attemptedSources = List.copyOf(attemptedSources);
    }
}

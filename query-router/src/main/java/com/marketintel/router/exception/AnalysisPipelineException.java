package com.marketintel.router.exception;

import lombok.Getter;

/**
 * Base of every failure the analysis pipeline reports to its caller.
 * Routing ambiguity and empty selections are results, not exceptions.
 */
@Getter
public class AnalysisPipelineException extends RuntimeException {

    public enum ErrorKind { DATASET_UNAVAILABLE, SCHEMA_VALIDATION_FAILED, PROCESSING_FAILED }

    private final String endpoint;
    private final ErrorKind kind;

    public AnalysisPipelineException(ErrorKind kind, String endpoint, String message) {
        super(message);
        this.kind = kind;
        this.endpoint = endpoint;
    }

    public AnalysisPipelineException(ErrorKind kind, String endpoint, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.endpoint = endpoint;
    }
}

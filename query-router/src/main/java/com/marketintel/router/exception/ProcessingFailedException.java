package com.marketintel.router.exception;

import lombok.Getter;

@Getter
public class ProcessingFailedException extends AnalysisPipelineException {

    private final String processor;

    public ProcessingFailedException(String endpoint, String processor, Throwable cause) {
        super(ErrorKind.PROCESSING_FAILED, endpoint,
                processor + " failed for " + endpoint + ": " + cause.getMessage(), cause);
        this.processor = processor;
    }
}

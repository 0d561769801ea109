package com.marketintel.router.exception;

import lombok.Getter;

@Getter
public class SchemaValidationException extends AnalysisPipelineException {

    private final String processor;

    public SchemaValidationException(String endpoint, String processor) {
        super(ErrorKind.SCHEMA_VALIDATION_FAILED, endpoint,
                "Dataset for " + endpoint + " failed " + processor + " validation");
        this.processor = processor;
    }
}

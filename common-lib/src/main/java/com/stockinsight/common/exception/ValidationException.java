package com.stockinsight.common.exception;

/** Request input rejected before any work is scheduled. */
public class ValidationException extends AnalysisException {

    public ValidationException(String message) {
        super("validation", message);
    }
}

package com.stockinsight.common.exception;

/**
 * Root of the platform's unchecked exceptions. The component name is prefixed to the
 * message so log lines and error events read {@code [component] message}.
 */
public class AnalysisException extends RuntimeException {
    private final String component;

    public AnalysisException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AnalysisException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}

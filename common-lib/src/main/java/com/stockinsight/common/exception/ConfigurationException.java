package com.stockinsight.common.exception;

/**
 * Invalid configuration value. Raised while configuration objects are built at
 * start-up and never at request time.
 */
public class ConfigurationException extends AnalysisException {

    public ConfigurationException(String message) {
        super("config", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("config", message, cause);
    }
}

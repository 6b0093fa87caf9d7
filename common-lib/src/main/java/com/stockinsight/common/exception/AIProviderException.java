package com.stockinsight.common.exception;

/**
 * A single AI backend failed. The narrative layer catches it and moves on to the
 * next configured provider.
 */
public class AIProviderException extends AnalysisException {

    public enum ErrorKind {
        AUTH,
        QUOTA,
        NETWORK,
        MALFORMED,
        UNAVAILABLE
    }

    private final String provider;
    private final ErrorKind kind;

    public AIProviderException(String provider, ErrorKind kind, String message) {
        super("ai:" + provider, kind + " " + message);
        this.provider = provider;
        this.kind = kind;
    }

    public AIProviderException(String provider, ErrorKind kind, String message, Throwable cause) {
        super("ai:" + provider, kind + " " + message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public String getProvider() {
        return provider;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

package com.roboticsradar.pipeline.service.source;

/** Connection, authentication or HTTP failure for a whole source. The source is skipped for the cycle. */
public class SourceUnavailableException extends RuntimeException {
    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String sourceName, String message) {
        this(sourceName, message, null);
    }

    public String getSourceName() {
        return sourceName;
    }
}

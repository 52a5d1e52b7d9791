package com.roboticsradar.pipeline.service.source;

/** A single feed entry that cannot be turned into an item. Only that entry is skipped. */
public class MalformedItemException extends RuntimeException {
    public MalformedItemException(String message) {
        super(message);
    }

    public MalformedItemException(String message, Throwable cause) {
        super(message, cause);
    }
}

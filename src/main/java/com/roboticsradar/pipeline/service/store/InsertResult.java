package com.roboticsradar.pipeline.service.store;

public enum InsertResult {
    INSERTED,
    /** An item with the same id was already stored; treated as a duplicate by the caller. */
    ALREADY_EXISTS
}

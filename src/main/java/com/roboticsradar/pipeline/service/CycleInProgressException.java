package com.roboticsradar.pipeline.service;

/** A cycle was requested while another one is still running. */
public class CycleInProgressException extends RuntimeException {
    public CycleInProgressException() {
        super("a pipeline cycle is already running");
    }
}

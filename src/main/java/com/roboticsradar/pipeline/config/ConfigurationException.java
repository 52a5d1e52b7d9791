package com.roboticsradar.pipeline.config;

import java.util.List;

/**
 * Missing or invalid pipeline configuration. Fatal at startup: no cycle runs with a
 * configuration that fails validation.
 */
public class ConfigurationException extends RuntimeException {
    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(List<String> problems) {
        super("Invalid radar configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}

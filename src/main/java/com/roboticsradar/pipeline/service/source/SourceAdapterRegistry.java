package com.roboticsradar.pipeline.service.source;

import com.roboticsradar.pipeline.config.ConfigurationException;
import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves configured sources to their adapters. Built once at startup; a configured kind
 * without an adapter fails startup.
 */
@Component
public class SourceAdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceAdapterRegistry.class);

    private final Map<SourceKind, SourceAdapter> adapters = new EnumMap<>(SourceKind.class);
    private final List<SourceSettings> sources;

    @Autowired
    public SourceAdapterRegistry(List<SourceAdapter> adapters, RadarProperties properties) {
        this(adapters, properties.getSources());
    }

    public SourceAdapterRegistry(List<SourceAdapter> adapters, List<SourceSettings> configured) {
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = this.adapters.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new ConfigurationException("two adapters registered for " + adapter.kind().key());
            }
            log.info("Registered source adapter: {} ({})", adapter.kind().key(), adapter.getClass().getSimpleName());
        }
        List<SourceSettings> enabled = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        for (SourceSettings s : configured) {
            if (!s.isEnabled()) continue;
            if (s.getKind() == null || !this.adapters.containsKey(s.getKind())) {
                problems.add("no adapter for source " + s);
                continue;
            }
            enabled.add(s);
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        this.sources = Collections.unmodifiableList(enabled);
    }

    public SourceAdapter adapterFor(SourceKind kind) {
        SourceAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new ConfigurationException("no adapter for source kind " + kind);
        }
        return adapter;
    }

    /** Enabled sources in configuration order. */
    public List<SourceSettings> enabledSources() {
        return sources;
    }
}

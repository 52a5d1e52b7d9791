package com.roboticsradar.pipeline.admin;

import com.roboticsradar.pipeline.dto.CycleDtos;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/** Summaries of the most recent cycles, newest first. Older entries are evicted. */
@Component
public class RunRegistry {
    static final int MAX_RUNS = 20;

    private final Map<String, CycleDtos.CycleSummary> runs = new ConcurrentHashMap<>();

    public void record(CycleDtos.CycleSummary summary) {
        if (summary == null || summary.getCycle_id() == null) return;
        runs.put(summary.getCycle_id(), summary);
        while (runs.size() > MAX_RUNS) {
            runs.values().stream()
                    .min(Comparator.comparing(CycleDtos.CycleSummary::getFinished_at))
                    .ifPresent(oldest -> runs.remove(oldest.getCycle_id()));
        }
    }

    public CycleDtos.CycleSummary get(String cycleId) {
        return runs.get(cycleId);
    }

    public CycleDtos.CycleSummary latest() {
        return runs.values().stream()
                .max(Comparator.comparing(CycleDtos.CycleSummary::getFinished_at))
                .orElse(null);
    }

    public List<CycleDtos.CycleSummary> recent() {
        return runs.values().stream()
                .sorted(Comparator.comparing(CycleDtos.CycleSummary::getFinished_at).reversed())
                .collect(Collectors.toList());
    }
}

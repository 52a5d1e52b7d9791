package com.roboticsradar.pipeline.controller;

import com.roboticsradar.pipeline.service.PipelineOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class HealthController {
    private final DatabaseClient db;
    private final PipelineOrchestrator orchestrator;

    public HealthController(DatabaseClient db, PipelineOrchestrator orchestrator) {
        this.db = db;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/healthz")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return db.sql("SELECT 1").fetch().first()
                .map(row -> ResponseEntity.ok(Map.<String, Object>of("ok", Boolean.TRUE, "cycle_running", orchestrator.isRunning())))
                .defaultIfEmpty(ResponseEntity.status(500).body(Map.<String, Object>of("ok", Boolean.FALSE)))
                .onErrorReturn(ResponseEntity.status(500).body(Map.<String, Object>of("ok", Boolean.FALSE)));
    }
}

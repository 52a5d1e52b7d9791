package com.roboticsradar.pipeline.controller;

import com.roboticsradar.pipeline.admin.RunRegistry;
import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.dto.CycleDtos;
import com.roboticsradar.pipeline.service.PipelineOrchestrator;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/cycle")
public class CycleController {
    private final PipelineOrchestrator orchestrator;
    private final RunRegistry runRegistry;
    private final RadarProperties properties;

    public CycleController(PipelineOrchestrator orchestrator, RunRegistry runRegistry, RadarProperties properties) {
        this.orchestrator = orchestrator;
        this.runRegistry = runRegistry;
        this.properties = properties;
    }

    /** Runs a cycle and returns its summary. A concurrent request gets 409. */
    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CycleDtos.CycleSummary>> run(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey) {
        if (adminKey == null || !adminKey.equals(properties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return orchestrator.runCycle().map(ResponseEntity::ok);
    }

    @GetMapping(value = "/latest", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CycleDtos.CycleSummary> latest() {
        CycleDtos.CycleSummary latest = runRegistry.latest();
        return latest != null ? ResponseEntity.ok(latest) : ResponseEntity.notFound().build();
    }

    @GetMapping(value = "/recent", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<CycleDtos.CycleSummary> recent() {
        return runRegistry.recent();
    }
}

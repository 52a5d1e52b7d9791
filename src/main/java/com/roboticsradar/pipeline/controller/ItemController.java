package com.roboticsradar.pipeline.controller;

import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.dto.CycleDtos;
import com.roboticsradar.pipeline.model.ScoredItem;
import com.roboticsradar.pipeline.service.RescoreService;
import com.roboticsradar.pipeline.service.store.ItemStore;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@Validated
@RequestMapping("/items")
public class ItemController {
    private static final int MAX_LIMIT = 200;

    private final ItemStore store;
    private final RescoreService rescoreService;
    private final RadarProperties properties;

    public ItemController(ItemStore store, RescoreService rescoreService, RadarProperties properties) {
        this.store = store;
        this.rescoreService = rescoreService;
        this.properties = properties;
    }

    /** Ranked stream for downstream delivery, highest score first. */
    @GetMapping(value = "/top", produces = MediaType.APPLICATION_JSON_VALUE)
    public Flux<ScoredItem> top(@RequestParam(value = "limit", defaultValue = "20") @Min(1) @Max(MAX_LIMIT) int limit) {
        return store.topItems(limit);
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ScoredItem>> get(@PathVariable("id") String id) {
        return store.findById(id)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping(value = "/{id}/rescore", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ScoredItem>> rescore(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("id") String id) {
        if (!isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return rescoreService.rescore(id)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping(value = "/rescore", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CycleDtos.RescoreReport>> rescoreRecent(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestParam(value = "days", defaultValue = "7") @Min(1) @Max(365) int days) {
        if (!isAdmin(adminKey)) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return rescoreService.rescoreRecent(days).map(ResponseEntity::ok);
    }

    private boolean isAdmin(String adminKey) {
        return adminKey != null && adminKey.equals(properties.getAdminKey());
    }
}

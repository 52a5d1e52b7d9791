package com.roboticsradar.pipeline.service;

import com.roboticsradar.pipeline.admin.RunRegistry;
import com.roboticsradar.pipeline.config.ConfigurationException;
import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.config.SourceSettings;
import com.roboticsradar.pipeline.dto.CycleDtos;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.RejectionReason;
import com.roboticsradar.pipeline.model.ScoredItem;
import com.roboticsradar.pipeline.service.dedup.DedupIndex;
import com.roboticsradar.pipeline.service.dedup.Deduplicator;
import com.roboticsradar.pipeline.service.dedup.DuplicateMatch;
import com.roboticsradar.pipeline.service.extract.Extraction;
import com.roboticsradar.pipeline.service.extract.KeywordExtractor;
import com.roboticsradar.pipeline.service.extract.RelevanceGate;
import com.roboticsradar.pipeline.service.extract.RelevanceVerdict;
import com.roboticsradar.pipeline.service.feedback.FeedbackSource;
import com.roboticsradar.pipeline.service.quality.QualityFilter;
import com.roboticsradar.pipeline.service.quality.QualityVerdict;
import com.roboticsradar.pipeline.service.scoring.ScoringEngine;
import com.roboticsradar.pipeline.service.source.SourceAdapterRegistry;
import com.roboticsradar.pipeline.service.store.InsertResult;
import com.roboticsradar.pipeline.service.store.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs one ingestion cycle: fetch every enabled source concurrently, then filter, extract,
 * gate on relevance and deduplicate each item, then score and persist the survivors.
 *
 * <p>Fetching and the per-item analysis run in parallel. Everything that depends on what
 * was admitted earlier in the same cycle (the store existence check, the in-cycle duplicate
 * check, scoring and the insert) runs in one serialized stage, so this is the only writer
 * to the store while a cycle runs. Only one cycle runs at a time.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final SourceAdapterRegistry adapters;
    private final QualityFilter qualityFilter;
    private final KeywordExtractor extractor;
    private final RelevanceGate relevanceGate;
    private final Deduplicator deduplicator;
    private final ScoringEngine scoringEngine;
    private final ItemStore store;
    private final FeedbackSource feedback;
    private final RunRegistry runRegistry;
    private final RadarProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PipelineOrchestrator(SourceAdapterRegistry adapters, QualityFilter qualityFilter, KeywordExtractor extractor,
                                RelevanceGate relevanceGate, Deduplicator deduplicator, ScoringEngine scoringEngine,
                                ItemStore store, FeedbackSource feedback, RunRegistry runRegistry,
                                RadarProperties properties, Clock clock) {
        this.adapters = adapters;
        this.qualityFilter = qualityFilter;
        this.extractor = extractor;
        this.relevanceGate = relevanceGate;
        this.deduplicator = deduplicator;
        this.scoringEngine = scoringEngine;
        this.store = store;
        this.feedback = feedback;
        this.runRegistry = runRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs a full cycle and emits its summary.
     *
     * @return the summary, or {@link CycleInProgressException} when a cycle is already running
     */
    public Mono<CycleDtos.CycleSummary> runCycle() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                return Mono.error(new CycleInProgressException());
            }
            return execute().doFinally(signal -> running.set(false));
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    private Mono<CycleDtos.CycleSummary> execute() {
        CycleRun run = new CycleRun(UUID.randomUUID().toString(), now(), properties.getPipeline().getRejectionSampleSize());
        OffsetDateTime since = run.startedAt.minusDays(properties.getDedup().getWindowDays());
        log.info("Cycle {} started with {} sources", run.cycleId, adapters.enabledSources().size());

        Mono<DedupIndex> snapshot = store.recentWindow(since)
                .collectList()
                .map(window -> {
                    log.debug("Dedup window holds {} items since {}", window.size(), since);
                    return deduplicator.index(window);
                });

        return snapshot.flatMap(window -> {
            DedupIndex admitted = deduplicator.newIndex();
            return Flux.fromIterable(adapters.enabledSources())
                    .flatMapSequential(source -> fetchSource(source, run), properties.getPipeline().getAdapterConcurrency())
                    .flatMapIterable(items -> items)
                    .flatMapSequential(item -> Mono.fromCallable(() -> analyse(item, window, run))
                                    .subscribeOn(Schedulers.parallel())
                                    .onErrorResume(PipelineOrchestrator::isItemError,
                                            e -> dropOnError(item, RejectionReason.ANALYSIS_ERROR, e, run)),
                            properties.getPipeline().getProcessingParallelism())
                    .concatMap(item -> persist(item, admitted, run)
                            .onErrorResume(PipelineOrchestrator::isItemError,
                                    e -> dropOnError(item, RejectionReason.STORE_ERROR, e, run)))
                    .collectList()
                    .map(persisted -> summarize(run, persisted));
        }).doOnNext(summary -> {
            runRegistry.record(summary);
            log.info("Cycle {} finished: fetched={}, persisted={}, rejected filter={} relevance={} duplicate={}, errors={}",
                    summary.getCycle_id(), summary.getFetched(), summary.getPersisted_count(),
                    summary.getRejected_filter(), summary.getRejected_relevance(), summary.getRejected_duplicate(),
                    summary.getErrors());
        }).doOnError(e -> log.error("Cycle {} failed: {}", run.cycleId, e.toString()));
    }

    /** All items of one source, or none with an unavailable report when it fails or times out. */
    private Mono<List<Item>> fetchSource(SourceSettings source, CycleRun run) {
        Duration timeout = properties.getPipeline().getAdapterTimeout();
        long started = System.nanoTime();
        return Mono.defer(() -> adapters.adapterFor(source.getKind()).fetch(source).collectList())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .map(items -> {
                    run.addSource(report(source, "ok", items.size(), null, started));
                    log.info("Source {} returned {} items", source, items.size());
                    return items;
                })
                .onErrorResume(e -> {
                    String error = e instanceof TimeoutException ? "timed out after " + timeout.toMillis() + " ms" : e.getMessage();
                    run.addSource(report(source, "unavailable", 0, error, started));
                    log.warn("Source {} unavailable: {}", source, error);
                    return Mono.just(List.of());
                });
    }

    /** Filter, extraction, relevance and snapshot dedup; returns null when the item is rejected. */
    private Item analyse(Item item, DedupIndex window, CycleRun run) {
        run.fetched();
        QualityVerdict quality = qualityFilter.evaluate(item);
        if (!quality.isAccepted()) {
            run.reject(item, quality.getReason(), quality.getDetail());
            return null;
        }

        Extraction extraction = extractor.extract(item.getText());
        item.setKeywords(extraction.getKeywords());
        item.setTags(extraction.getTopics());
        RelevanceVerdict relevance = relevanceGate.evaluate(item, extraction);
        if (!relevance.isRelevant()) {
            run.reject(item, relevance.getReason(), relevance.getMatchedTerm());
            return null;
        }

        if (window.containsId(item.getId())) {
            run.reject(item, RejectionReason.ALREADY_EXISTS, item.getId());
            return null;
        }
        DuplicateMatch match = deduplicator.check(item, window);
        if (match.isDuplicate()) {
            run.reject(item, reasonFor(match), match.toString());
            return null;
        }
        return item;
    }

    private Mono<ScoredItem> persist(Item item, DedupIndex admitted, CycleRun run) {
        return Mono.defer(() -> store.exists(item.getId())).flatMap(exists -> {
            if (exists) {
                run.reject(item, RejectionReason.ALREADY_EXISTS, item.getId());
                return Mono.empty();
            }
            DuplicateMatch match = deduplicator.check(item, admitted);
            if (match.isDuplicate()) {
                run.reject(item, reasonFor(match), match.toString());
                return Mono.empty();
            }
            return feedback.getFeedbackAggregate(item.getId())
                    .map(agg -> scoringEngine.score(item, agg, run.startedAt))
                    .flatMap(scored -> store.insert(scored).flatMap(result -> {
                        if (result == InsertResult.ALREADY_EXISTS) {
                            run.reject(item, RejectionReason.ALREADY_EXISTS, "conflict on insert");
                            return Mono.<ScoredItem>empty();
                        }
                        admitted.add(scored);
                        return Mono.just(scored);
                    }));
        });
    }

    /** Configuration problems still end the cycle; anything else only costs the item. */
    private static boolean isItemError(Throwable e) {
        return !(e instanceof ConfigurationException);
    }

    private static <T> Mono<T> dropOnError(Item item, RejectionReason reason, Throwable e, CycleRun run) {
        log.warn("Dropped {} after {}: {}", item.getId(), reason.code(), e.toString());
        run.reject(item, reason, e.toString());
        return Mono.empty();
    }

    private static RejectionReason reasonFor(DuplicateMatch match) {
        switch (match.getKind()) {
            case URL: return RejectionReason.DUPLICATE_URL;
            case TITLE: return RejectionReason.DUPLICATE_TITLE;
            default: return RejectionReason.DUPLICATE_CONTENT;
        }
    }

    private CycleDtos.CycleSummary summarize(CycleRun run, List<ScoredItem> persisted) {
        List<ScoredItem> ranked = new ArrayList<>(persisted);
        ranked.sort(Comparator.comparingDouble(ScoredItem::scoreValue).reversed());

        CycleDtos.CycleSummary summary = new CycleDtos.CycleSummary();
        summary.setCycle_id(run.cycleId);
        summary.setStarted_at(run.startedAt);
        summary.setFinished_at(now());
        summary.setFetched(run.fetchedCount());
        summary.setRejected_filter(run.countFor(RejectionReason.Stage.FILTER));
        summary.setRejected_relevance(run.countFor(RejectionReason.Stage.RELEVANCE));
        summary.setRejected_duplicate(run.countFor(RejectionReason.Stage.DUPLICATE));
        summary.setErrors(run.countFor(RejectionReason.Stage.ERROR));
        summary.setRejected_by_reason(run.countsByReason());
        summary.setRejections(run.samples());
        summary.setSources(run.sources());
        summary.setPersisted_count(ranked.size());
        summary.setPersisted(ranked);
        return summary;
    }

    private static CycleDtos.SourceReport report(SourceSettings source, String status, int fetched, String error, long startedNanos) {
        CycleDtos.SourceReport r = new CycleDtos.SourceReport();
        r.setSource_name(source.getName());
        r.setSource_kind(source.getKind() != null ? source.getKind().key() : null);
        r.setStatus(status);
        r.setFetched(fetched);
        r.setError(error);
        r.setDuration_ms(Duration.ofNanos(System.nanoTime() - startedNanos).toMillis());
        return r;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    /** Mutable bookkeeping of one cycle, shared by the parallel stages. */
    private static final class CycleRun {
        final String cycleId;
        final OffsetDateTime startedAt;
        private final int sampleLimit;
        private final Map<RejectionReason, Integer> counts = new EnumMap<>(RejectionReason.class);
        private final List<CycleDtos.Rejection> samples = new ArrayList<>();
        private final List<CycleDtos.SourceReport> sources = Collections.synchronizedList(new ArrayList<>());
        private int fetched;

        CycleRun(String cycleId, OffsetDateTime startedAt, int sampleLimit) {
            this.cycleId = cycleId;
            this.startedAt = startedAt;
            this.sampleLimit = sampleLimit;
        }

        synchronized void fetched() {
            fetched++;
        }

        synchronized int fetchedCount() {
            return fetched;
        }

        synchronized void reject(Item item, RejectionReason reason, String detail) {
            counts.merge(reason, 1, Integer::sum);
            log.debug("Rejected {} ({}): {}", item.getId(), reason.code(), detail);
            if (samples.size() < sampleLimit) {
                CycleDtos.Rejection r = new CycleDtos.Rejection();
                r.setItem_id(item.getId());
                r.setSource_name(item.getSourceName());
                r.setTitle(item.getTitle());
                r.setStage(reason.stage().name().toLowerCase(Locale.ROOT));
                r.setReason(reason.code());
                r.setDetail(detail);
                samples.add(r);
            }
        }

        void addSource(CycleDtos.SourceReport report) {
            sources.add(report);
        }

        synchronized int countFor(RejectionReason.Stage stage) {
            return counts.entrySet().stream()
                    .filter(e -> e.getKey().stage() == stage)
                    .mapToInt(Map.Entry::getValue)
                    .sum();
        }

        synchronized Map<String, Integer> countsByReason() {
            Map<String, Integer> out = new LinkedHashMap<>();
            counts.forEach((reason, count) -> out.put(reason.code(), count));
            return out;
        }

        synchronized List<CycleDtos.Rejection> samples() {
            return new ArrayList<>(samples);
        }

        List<CycleDtos.SourceReport> sources() {
            synchronized (sources) {
                return sources.stream().collect(Collectors.toList());
            }
        }
    }
}

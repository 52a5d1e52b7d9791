package com.roboticsradar.pipeline.dto;

import com.roboticsradar.pipeline.model.ScoredItem;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public class CycleDtos {

    /** Outcome of one source in one cycle. */
    public static class SourceReport {
        private String source_name;
        private String source_kind;
        private String status; // ok | unavailable
        private int fetched;
        private String error; // set when unavailable
        private long duration_ms;

        public String getSource_name() { return source_name; }
        public void setSource_name(String source_name) { this.source_name = source_name; }
        public String getSource_kind() { return source_kind; }
        public void setSource_kind(String source_kind) { this.source_kind = source_kind; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public int getFetched() { return fetched; }
        public void setFetched(int fetched) { this.fetched = fetched; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
        public long getDuration_ms() { return duration_ms; }
        public void setDuration_ms(long duration_ms) { this.duration_ms = duration_ms; }
    }

    /** One rejected item kept as a sample in the summary. */
    public static class Rejection {
        private String item_id;
        private String source_name;
        private String title;
        private String stage; // filter | relevance | duplicate
        private String reason;
        private String detail;

        public String getItem_id() { return item_id; }
        public void setItem_id(String item_id) { this.item_id = item_id; }
        public String getSource_name() { return source_name; }
        public void setSource_name(String source_name) { this.source_name = source_name; }
        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getStage() { return stage; }
        public void setStage(String stage) { this.stage = stage; }
        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }
        public String getDetail() { return detail; }
        public void setDetail(String detail) { this.detail = detail; }
    }

    /** Everything a cycle did, returned by the trigger endpoint and kept for the dashboard. */
    public static class CycleSummary {
        private String cycle_id;
        private OffsetDateTime started_at;
        private OffsetDateTime finished_at;
        private int fetched;
        private int rejected_filter;
        private int rejected_relevance;
        private int rejected_duplicate;
        private int errors; // items dropped by a failure rather than a rule
        private int persisted_count;
        private Map<String, Integer> rejected_by_reason;
        private List<Rejection> rejections; // bounded sample
        private List<SourceReport> sources;
        private List<ScoredItem> persisted; // score descending

        public String getCycle_id() { return cycle_id; }
        public void setCycle_id(String cycle_id) { this.cycle_id = cycle_id; }
        public OffsetDateTime getStarted_at() { return started_at; }
        public void setStarted_at(OffsetDateTime started_at) { this.started_at = started_at; }
        public OffsetDateTime getFinished_at() { return finished_at; }
        public void setFinished_at(OffsetDateTime finished_at) { this.finished_at = finished_at; }
        public int getFetched() { return fetched; }
        public void setFetched(int fetched) { this.fetched = fetched; }
        public int getRejected_filter() { return rejected_filter; }
        public void setRejected_filter(int rejected_filter) { this.rejected_filter = rejected_filter; }
        public int getRejected_relevance() { return rejected_relevance; }
        public void setRejected_relevance(int rejected_relevance) { this.rejected_relevance = rejected_relevance; }
        public int getRejected_duplicate() { return rejected_duplicate; }
        public void setRejected_duplicate(int rejected_duplicate) { this.rejected_duplicate = rejected_duplicate; }
        public int getErrors() { return errors; }
        public void setErrors(int errors) { this.errors = errors; }
        public int getPersisted_count() { return persisted_count; }
        public void setPersisted_count(int persisted_count) { this.persisted_count = persisted_count; }
        public Map<String, Integer> getRejected_by_reason() { return rejected_by_reason; }
        public void setRejected_by_reason(Map<String, Integer> rejected_by_reason) { this.rejected_by_reason = rejected_by_reason; }
        public List<Rejection> getRejections() { return rejections; }
        public void setRejections(List<Rejection> rejections) { this.rejections = rejections; }
        public List<SourceReport> getSources() { return sources; }
        public void setSources(List<SourceReport> sources) { this.sources = sources; }
        public List<ScoredItem> getPersisted() { return persisted; }
        public void setPersisted(List<ScoredItem> persisted) { this.persisted = persisted; }
    }

    public static class RescoreReport {
        private int rescored;
        private int window_days;

        public RescoreReport() {}

        public RescoreReport(int rescored, int window_days) {
            this.rescored = rescored;
            this.window_days = window_days;
        }

        public int getRescored() { return rescored; }
        public void setRescored(int rescored) { this.rescored = rescored; }
        public int getWindow_days() { return window_days; }
        public void setWindow_days(int window_days) { this.window_days = window_days; }
    }
}

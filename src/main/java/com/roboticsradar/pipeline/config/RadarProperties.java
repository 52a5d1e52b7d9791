package com.roboticsradar.pipeline.config;

import com.roboticsradar.pipeline.model.SourceKind;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All pipeline configuration under the {@code radar} prefix.
 *
 * <p>Unknown keys fail binding ({@code ignoreUnknownFields = false}) so a typo in a weight
 * name is reported at startup instead of silently falling back to a default. Values are
 * checked by {@link #validate()} once bound.
 */
@ConfigurationProperties(prefix = "radar", ignoreUnknownFields = false)
public class RadarProperties {
    /** Shared secret expected in the {@code x-admin-key} header of admin endpoints. */
    private String adminKey;
    private Domain domain = new Domain();
    private Quality quality = new Quality();
    private Extraction extraction = new Extraction();
    private Dedup dedup = new Dedup();
    private Scoring scoring = new Scoring();
    private Pipeline pipeline = new Pipeline();
    private List<SourceSettings> sources = new ArrayList<>();

    @PostConstruct
    public void validateOnStartup() {
        validate();
    }

    /**
     * Checks every section and reports all problems at once.
     *
     * @throws ConfigurationException when anything is missing or out of range
     */
    public void validate() {
        List<String> problems = new ArrayList<>();

        if (domain.getKeywords().isEmpty() && domain.getTopics().isEmpty()) {
            problems.add("radar.domain needs at least one keyword or topic");
        }
        for (Map.Entry<String, List<String>> t : domain.getTopics().entrySet()) {
            if (t.getValue() == null || t.getValue().isEmpty()) {
                problems.add("radar.domain.topics." + t.getKey() + " has no trigger terms");
            }
        }

        if (quality.getMinLength() < 0) problems.add("radar.quality.min-length must be >= 0");
        if (quality.getMaxAgeDays() < 0) problems.add("radar.quality.max-age-days must be >= 0");

        if (extraction.getTopK() < 1) problems.add("radar.extraction.top-k must be >= 1");

        checkThreshold(problems, "radar.dedup.title-threshold", dedup.getTitleThreshold());
        checkThreshold(problems, "radar.dedup.content-threshold", dedup.getContentThreshold());
        if (dedup.getWindowDays() < 1) problems.add("radar.dedup.window-days must be >= 1");
        if (!Dedup.SIMILARITY_ALGORITHMS.contains(dedup.getSimilarity())) {
            problems.add("radar.dedup.similarity must be one of " + Dedup.SIMILARITY_ALGORITHMS + " but was " + dedup.getSimilarity());
        }

        checkWeight(problems, "radar.scoring.likes", scoring.getLikes());
        checkWeight(problems, "radar.scoring.shares", scoring.getShares());
        checkWeight(problems, "radar.scoring.replies", scoring.getReplies());
        checkWeight(problems, "radar.scoring.feedback", scoring.getFeedback());
        if (!(scoring.getHalfLifeHours() > 0)) problems.add("radar.scoring.half-life-hours must be > 0");
        if (!(scoring.getInferredTimestampPenalty() >= 0 && scoring.getInferredTimestampPenalty() <= 1)) {
            problems.add("radar.scoring.inferred-timestamp-penalty must be within [0, 1]");
        }
        for (String key : scoring.getSourceBonus().keySet()) {
            try {
                SourceKind.fromKey(key);
            } catch (IllegalArgumentException e) {
                problems.add("radar.scoring.source-bonus." + key + " does not name a source kind");
            }
        }
        for (Map.Entry<String, Double> e : scoring.getSourceBonus().entrySet()) {
            if (e.getValue() == null || !Double.isFinite(e.getValue())) problems.add("radar.scoring.source-bonus." + e.getKey() + " must be a number");
        }
        for (Map.Entry<String, Double> e : scoring.getTagBonus().entrySet()) {
            if (e.getValue() == null || !Double.isFinite(e.getValue())) problems.add("radar.scoring.tag-bonus." + e.getKey() + " must be a number");
        }

        if (pipeline.getAdapterConcurrency() < 1) problems.add("radar.pipeline.adapter-concurrency must be >= 1");
        if (pipeline.getProcessingParallelism() < 1) problems.add("radar.pipeline.processing-parallelism must be >= 1");
        if (pipeline.getAdapterTimeout() == null || pipeline.getAdapterTimeout().isNegative() || pipeline.getAdapterTimeout().isZero()) {
            problems.add("radar.pipeline.adapter-timeout must be positive");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < sources.size(); i++) {
            SourceSettings s = sources.get(i);
            String path = "radar.sources[" + i + "]";
            if (s.getName() == null || s.getName().isBlank()) {
                problems.add(path + ".name is required");
            } else if (!names.add(s.getName())) {
                problems.add(path + ".name '" + s.getName() + "' is not unique");
            }
            if (s.getKind() == null) {
                problems.add(path + ".kind is required");
            } else if (s.getKind() != SourceKind.HACKERNEWS && (s.getUrl() == null || s.getUrl().isBlank())) {
                problems.add(path + ".url is required for " + s.getKind().key() + " sources");
            }
            if (s.getLimit() < 1) problems.add(path + ".limit must be >= 1");
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    private static void checkThreshold(List<String> problems, String name, double value) {
        if (!(value > 0.0 && value <= 1.0)) problems.add(name + " must be within (0, 1]");
    }

    private static void checkWeight(List<String> problems, String name, double value) {
        if (!Double.isFinite(value) || value < 0) problems.add(name + " must be a non-negative number");
    }

    /** Domain vocabulary driving the relevance gate and topic tagging. */
    public static class Domain {
        /** Inclusion keywords; an item must match one of them or a topic. */
        private List<String> keywords = new ArrayList<>();
        /** Exclusion keywords; a match rejects the item even when it is otherwise relevant. */
        private List<String> excludeKeywords = new ArrayList<>();
        /** Accepted languages for items that declare one. Empty accepts all. */
        private List<String> languages = new ArrayList<>(List.of("en"));
        /** Canonical topic to trigger terms. */
        private Map<String, List<String>> topics = new LinkedHashMap<>();

        public List<String> getKeywords() { return keywords; }
        public void setKeywords(List<String> keywords) { this.keywords = keywords != null ? keywords : new ArrayList<>(); }
        public List<String> getExcludeKeywords() { return excludeKeywords; }
        public void setExcludeKeywords(List<String> excludeKeywords) { this.excludeKeywords = excludeKeywords != null ? excludeKeywords : new ArrayList<>(); }
        public List<String> getLanguages() { return languages; }
        public void setLanguages(List<String> languages) { this.languages = languages != null ? languages : new ArrayList<>(); }
        public Map<String, List<String>> getTopics() { return topics; }
        public void setTopics(Map<String, List<String>> topics) { this.topics = topics != null ? topics : new LinkedHashMap<>(); }
    }

    public static class Quality {
        /** Minimum length of the whitespace-normalized text. */
        private int minLength = 40;
        /** Placeholder phrases marking content that was not actually retrieved. */
        private List<String> stubPatterns = new ArrayList<>(List.of(
                "read more", "click here", "coming soon", "continue reading", "full story", "[removed]", "[deleted]"));
        /** Items published longer ago than this are dropped; 0 disables the check. */
        private int maxAgeDays = 7;

        public int getMinLength() { return minLength; }
        public void setMinLength(int minLength) { this.minLength = minLength; }
        public List<String> getStubPatterns() { return stubPatterns; }
        public void setStubPatterns(List<String> stubPatterns) { this.stubPatterns = stubPatterns != null ? stubPatterns : new ArrayList<>(); }
        public int getMaxAgeDays() { return maxAgeDays; }
        public void setMaxAgeDays(int maxAgeDays) { this.maxAgeDays = maxAgeDays; }
    }

    public static class Extraction {
        private int topK = 10;

        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }
    }

    public static class Dedup {
        static final Set<String> SIMILARITY_ALGORITHMS = Set.of("levenshtein", "token-set");

        private double titleThreshold = 0.80;
        private double contentThreshold = 0.70;
        /** Items ingested within this many days form the comparison window. */
        private int windowDays = 7;
        /** {@code levenshtein} (normalized edit distance) or {@code token-set} (Jaccard over word sets). */
        private String similarity = "levenshtein";
        /** Query parameters dropped before URLs are compared; a trailing {@code *} matches a prefix. */
        private List<String> trackingParams = new ArrayList<>(List.of(
                "utm_*", "fbclid", "gclid", "ref", "ref_src", "mc_cid", "mc_eid", "igshid"));

        public double getTitleThreshold() { return titleThreshold; }
        public void setTitleThreshold(double titleThreshold) { this.titleThreshold = titleThreshold; }
        public double getContentThreshold() { return contentThreshold; }
        public void setContentThreshold(double contentThreshold) { this.contentThreshold = contentThreshold; }
        public int getWindowDays() { return windowDays; }
        public void setWindowDays(int windowDays) { this.windowDays = windowDays; }
        public String getSimilarity() { return similarity; }
        public void setSimilarity(String similarity) { this.similarity = similarity; }
        public List<String> getTrackingParams() { return trackingParams; }
        public void setTrackingParams(List<String> trackingParams) { this.trackingParams = trackingParams != null ? trackingParams : new ArrayList<>(); }
    }

    /** Weights of the scoring formula. Defaults match the documented formula. */
    public static class Scoring {
        private double likes = 1.0;
        private double shares = 2.0;
        private double replies = 1.5;
        private double feedback = 3.0;
        private double halfLifeHours = 48.0;
        /** Extra recency multiplier for items whose timestamp was inferred from fetch time. */
        private double inferredTimestampPenalty = 0.75;
        /** Flat bonus per source kind key ({@code rss}, {@code reddit}, ...). */
        private Map<String, Double> sourceBonus = new LinkedHashMap<>();
        /** Bonus per topic tag. */
        private Map<String, Double> tagBonus = new LinkedHashMap<>();

        public double getLikes() { return likes; }
        public void setLikes(double likes) { this.likes = likes; }
        public double getShares() { return shares; }
        public void setShares(double shares) { this.shares = shares; }
        public double getReplies() { return replies; }
        public void setReplies(double replies) { this.replies = replies; }
        public double getFeedback() { return feedback; }
        public void setFeedback(double feedback) { this.feedback = feedback; }
        public double getHalfLifeHours() { return halfLifeHours; }
        public void setHalfLifeHours(double halfLifeHours) { this.halfLifeHours = halfLifeHours; }
        public double getInferredTimestampPenalty() { return inferredTimestampPenalty; }
        public void setInferredTimestampPenalty(double inferredTimestampPenalty) { this.inferredTimestampPenalty = inferredTimestampPenalty; }
        public Map<String, Double> getSourceBonus() { return sourceBonus; }
        public void setSourceBonus(Map<String, Double> sourceBonus) { this.sourceBonus = sourceBonus != null ? sourceBonus : new LinkedHashMap<>(); }
        public Map<String, Double> getTagBonus() { return tagBonus; }
        public void setTagBonus(Map<String, Double> tagBonus) { this.tagBonus = tagBonus != null ? tagBonus : new LinkedHashMap<>(); }
    }

    public static class Pipeline {
        private int adapterConcurrency = 8;
        private Duration adapterTimeout = Duration.ofSeconds(15);
        private int processingParallelism = 4;
        /** Upper bound on the rejection samples kept in a cycle summary. */
        private int rejectionSampleSize = 100;
        private String userAgent = "RoboticsRadar/1.0 (+https://github.com/robotics-radar)";

        public int getAdapterConcurrency() { return adapterConcurrency; }
        public void setAdapterConcurrency(int adapterConcurrency) { this.adapterConcurrency = adapterConcurrency; }
        public Duration getAdapterTimeout() { return adapterTimeout; }
        public void setAdapterTimeout(Duration adapterTimeout) { this.adapterTimeout = adapterTimeout; }
        public int getProcessingParallelism() { return processingParallelism; }
        public void setProcessingParallelism(int processingParallelism) { this.processingParallelism = processingParallelism; }
        public int getRejectionSampleSize() { return rejectionSampleSize; }
        public void setRejectionSampleSize(int rejectionSampleSize) { this.rejectionSampleSize = rejectionSampleSize; }
        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    }

    public String getAdminKey() { return adminKey; }
    public void setAdminKey(String adminKey) { this.adminKey = adminKey; }
    public Domain getDomain() { return domain; }
    public void setDomain(Domain domain) { this.domain = domain; }
    public Quality getQuality() { return quality; }
    public void setQuality(Quality quality) { this.quality = quality; }
    public Extraction getExtraction() { return extraction; }
    public void setExtraction(Extraction extraction) { this.extraction = extraction; }
    public Dedup getDedup() { return dedup; }
    public void setDedup(Dedup dedup) { this.dedup = dedup; }
    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public List<SourceSettings> getSources() { return sources; }
    public void setSources(List<SourceSettings> sources) { this.sources = sources != null ? sources : new ArrayList<>(); }
}

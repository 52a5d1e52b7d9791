package com.roboticsradar.pipeline.service.extract;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Ranked keywords and matched topic labels for one text. */
public class Extraction {
    private final List<String> keywords;
    private final Set<String> topics;

    public Extraction(List<String> keywords, Set<String> topics) {
        this.keywords = List.copyOf(keywords);
        this.topics = Collections.unmodifiableSet(new LinkedHashSet<>(topics));
    }

    public List<String> getKeywords() { return keywords; }
    public Set<String> getTopics() { return topics; }
}

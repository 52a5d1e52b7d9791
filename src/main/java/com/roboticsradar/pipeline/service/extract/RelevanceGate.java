package com.roboticsradar.pipeline.service.extract;

import com.roboticsradar.pipeline.config.RadarProperties;
import com.roboticsradar.pipeline.model.Item;
import com.roboticsradar.pipeline.model.RejectionReason;
import com.roboticsradar.pipeline.util.TermPatterns;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether an item belongs to the domain. An exclusion keyword always rejects;
 * otherwise at least one inclusion keyword or topic has to match. Items declaring a
 * language outside the configured set are rejected before either check.
 */
@Service
public class RelevanceGate {
    private final Map<String, Pattern> inclusions = new LinkedHashMap<>();
    private final Map<String, Pattern> exclusions = new LinkedHashMap<>();
    private final Set<String> languages;

    public RelevanceGate(RadarProperties properties) {
        RadarProperties.Domain domain = properties.getDomain();
        for (String k : domain.getKeywords()) {
            if (k != null && !k.isBlank()) inclusions.put(k.trim().toLowerCase(Locale.ROOT), TermPatterns.wholeWord(k));
        }
        for (String k : domain.getExcludeKeywords()) {
            if (k != null && !k.isBlank()) exclusions.put(k.trim().toLowerCase(Locale.ROOT), TermPatterns.wholeWord(k));
        }
        this.languages = domain.getLanguages().stream()
                .filter(l -> l != null && !l.isBlank())
                .map(RelevanceGate::primaryLanguage)
                .collect(Collectors.toSet());
    }

    public RelevanceVerdict evaluate(Item item, Extraction extraction) {
        if (item.getLanguage() != null && !item.getLanguage().isBlank() && !languages.isEmpty()
                && !languages.contains(primaryLanguage(item.getLanguage()))) {
            return RelevanceVerdict.reject(RejectionReason.UNSUPPORTED_LANGUAGE, item.getLanguage());
        }

        String text = item.getText();
        String keywordText = String.join(" ", extraction.getKeywords());
        for (Map.Entry<String, Pattern> e : exclusions.entrySet()) {
            if (e.getValue().matcher(text).find()) {
                return RelevanceVerdict.reject(RejectionReason.EXCLUDED, e.getKey());
            }
        }
        for (Map.Entry<String, Pattern> e : inclusions.entrySet()) {
            if (e.getValue().matcher(text).find() || e.getValue().matcher(keywordText).find()) {
                return RelevanceVerdict.relevant(e.getKey());
            }
        }
        if (!extraction.getTopics().isEmpty()) {
            List<String> topics = List.copyOf(extraction.getTopics());
            return RelevanceVerdict.relevant(topics.get(0));
        }
        return RelevanceVerdict.reject(RejectionReason.NOT_RELEVANT, null);
    }

    /** {@code en-US} and {@code en_gb} both count as {@code en}. */
    static String primaryLanguage(String tag) {
        String t = tag.trim().toLowerCase(Locale.ROOT);
        int cut = t.indexOf('-');
        if (cut < 0) cut = t.indexOf('_');
        return cut > 0 ? t.substring(0, cut) : t;
    }
}

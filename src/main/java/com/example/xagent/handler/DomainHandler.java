package com.example.xagent.handler;

import com.example.xagent.model.RequirementDraft;

import java.util.List;
import java.util.Locale;

/**
 * Strategy for one business domain: scores how well a document fits the domain and
 * proposes requirements and stakeholders for it.
 * <p>
 * Implementations are stateless; a single instance per domain name is shared across
 * concurrent pipeline runs through the {@code HandlerCatalog}.
 */
public interface DomainHandler {

    /** Unique domain name, e.g. {@code healthcare}. */
    String name();

    /** Lower-case detection keywords; multi-word phrases weigh by their word count. */
    List<String> keywords();

    /** Specificity on a 1..5 scale, used to weight detection confidence. */
    int priorityScore();

    /** Domain requirements suggested by the content, in extraction order. */
    List<RequirementDraft> extractRequirements(String content);

    /** Security, reliability and real-time concerns; the default set fits most domains. */
    default List<RequirementDraft> crossCuttingRequirements(String content) {
        return CrossCuttingConcerns.detect(content);
    }

    default List<String> extractStakeholders(String content) {
        return List.of("End Users", "Development Team");
    }

    /**
     * Keyword affinity of the content, in [0,1].
     * <p>
     * Each keyword present in the lower-cased content counts once, multi-word phrases
     * count their word count. The sum is normalized by 20% of an expected baseline of
     * two words per keyword. Depends only on the content and {@link #keywords()}.
     */
    default double detectConfidence(String content) {
        if (content == null || content.isEmpty()) return 0.0;
        String lower = content.toLowerCase(Locale.ROOT);
        List<String> keywords = keywords();

        int matches = 0;
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                int words = keyword.trim().split("\\s+").length;
                matches += Math.max(words, 1);
            }
        }

        double baseline = keywords.size() * 2 * 0.2;
        return Math.min(matches / Math.max(baseline, 1.0), 1.0);
    }
}

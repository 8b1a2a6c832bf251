package com.example.xagent.agent;

import com.example.xagent.handler.DomainDefinitionValidator;
import com.example.xagent.handler.GeneralDomainHandler;
import com.example.xagent.model.DomainDefinition;
import com.example.xagent.model.DomainDefinition.RequirementRule;
import com.example.xagent.model.Priority;
import com.example.xagent.model.RequirementCategory;
import com.example.xagent.model.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic synthesizer: derives a domain definition from the content with a fixed
 * domain pattern table, term frequencies and requirement templates. No model calls,
 * no randomness, zero cost.
 */
public class TemplatePluginSynthesizer implements PluginSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(TemplatePluginSynthesizer.class);

    private static final Pattern WORD = Pattern.compile("\\b[a-z]{3,}\\b");
    private static final int KEY_TERM_COUNT = 10;
    private static final String CUSTOM_SUFFIX = "_custom";

    /** Known verticals and the terms that suggest them. Iteration order breaks ties. */
    private static final Map<String, List<String>> DOMAIN_PATTERNS = new LinkedHashMap<>();

    static {
        DOMAIN_PATTERNS.put("healthcare", List.of("patient", "medical", "diagnosis", "treatment", "clinical", "hospital"));
        DOMAIN_PATTERNS.put("finance", List.of("payment", "transaction", "banking", "loan", "credit", "investment"));
        DOMAIN_PATTERNS.put("education", List.of("student", "course", "curriculum", "grade", "assignment", "learning"));
        DOMAIN_PATTERNS.put("retail", List.of("product", "inventory", "sales", "customer", "order", "shipping"));
        DOMAIN_PATTERNS.put("manufacturing", List.of("production", "quality", "supply chain", "machinery", "assembly"));
        DOMAIN_PATTERNS.put("logistics", List.of("shipping", "delivery", "warehouse", "tracking", "fleet", "route"));
        DOMAIN_PATTERNS.put("gaming", List.of("player", "level", "score", "achievement", "multiplayer", "game"));
        DOMAIN_PATTERNS.put("social_media", List.of("post", "feed", "like", "share", "comment", "profile"));
        DOMAIN_PATTERNS.put("beekeeping", List.of("hive", "honey", "apiary", "beekeeper", "colony", "pollen"));
    }

    private static final Map<String, List<String>> STAKEHOLDER_PATTERNS = new LinkedHashMap<>();

    static {
        STAKEHOLDER_PATTERNS.put("admin", List.of("System Administrators"));
        STAKEHOLDER_PATTERNS.put("manager", List.of("Management Team"));
        STAKEHOLDER_PATTERNS.put("customer", List.of("Customers", "Customer Service"));
        STAKEHOLDER_PATTERNS.put("doctor", List.of("Medical Staff", "Healthcare Providers"));
        STAKEHOLDER_PATTERNS.put("teacher", List.of("Educators", "Academic Staff"));
        STAKEHOLDER_PATTERNS.put("student", List.of("Students", "Learners"));
        STAKEHOLDER_PATTERNS.put("vendor", List.of("Vendors", "Suppliers"));
        STAKEHOLDER_PATTERNS.put("investor", List.of("Investors", "Financial Stakeholders"));
    }

    /** Function words and generic software vocabulary that say nothing about a domain. */
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "into", "our", "their", "they",
            "them", "are", "was", "were", "will", "would", "should", "could", "must", "shall",
            "can", "has", "have", "had", "not", "but", "all", "any", "each", "per", "via",
            "its", "also", "more", "most", "than", "then", "when", "where", "which", "who",
            "what", "how", "why", "been", "being", "such", "other", "these", "those", "there",
            "need", "needs", "want", "wants", "build", "create", "make", "use", "using", "used",
            "system", "systems", "application", "app", "platform", "software", "tool", "tools",
            "user", "users", "data", "management", "manage", "track", "tracking", "support",
            "feature", "features", "new", "able", "allow", "allows", "provide", "including",
            "include", "includes", "based", "well", "every", "both", "some", "very", "just");

    private final int minimumPriority;

    public TemplatePluginSynthesizer(int minimumPriority) {
        this.minimumPriority = Math.max(DomainDefinitionValidator.MIN_PRIORITY,
                Math.min(minimumPriority, DomainDefinitionValidator.MAX_PRIORITY));
    }

    @Override
    public SynthesisResult synthesize(String content, String domainHint, List<String> existingNames) {
        if (content == null || content.isBlank()) {
            return SynthesisResult.failure("No content to derive a domain from");
        }
        String lower = content.toLowerCase(Locale.ROOT);
        Set<String> taken = new LinkedHashSet<>(existingNames != null ? existingNames : List.of());
        taken.add(GeneralDomainHandler.NAME);

        Map.Entry<String, Double> bestPattern = bestPattern(lower);
        List<String> keyTerms = keyTerms(lower);
        if (keyTerms.size() < DomainDefinitionValidator.MIN_KEYWORDS) {
            return SynthesisResult.failure("Content has only " + keyTerms.size()
                    + " distinctive terms, at least " + DomainDefinitionValidator.MIN_KEYWORDS + " are needed");
        }

        String name = chooseName(domainHint, bestPattern, keyTerms, taken);
        if (name == null) {
            return SynthesisResult.failure("No free domain name could be derived from the content");
        }

        int priority = Math.min(DomainDefinitionValidator.MAX_PRIORITY,
                Math.max(minimumPriority, (int) (bestPattern.getValue() * 5)));

        DomainDefinition definition = new DomainDefinition(
                name,
                keyTerms,
                priority,
                requirementRules(lower, name),
                stakeholders(lower),
                List.of(),
                null,
                false,
                0.0,
                null,
                null);

        PluginQuality quality = assessQuality(definition, crossCuttingConcerns(lower));
        log.info("[Template Synthesizer] Derived domain '{}' (pattern match {} = {}, priority {}, quality {}/100)",
                name, bestPattern.getKey(), "%.2f".formatted(bestPattern.getValue()), priority, quality.score());
        if (!quality.recommendations().isEmpty()) {
            log.debug("[Template Synthesizer] Recommendations for '{}': {}", name, quality.recommendations());
        }
        return SynthesisResult.success(definition, 0.0);
    }

    /**
     * Quality estimate of a generated definition.
     *
     * @param score           0..100
     * @param recommendations how the definition could be improved
     */
    public record PluginQuality(int score, List<String> recommendations) {}

    /** Scores keyword, rule, stakeholder, priority and cross-cutting coverage of a definition. */
    public static PluginQuality assessQuality(DomainDefinition definition, List<String> crossCutting) {
        int score = 0;
        List<String> recommendations = new ArrayList<>();

        int keywords = definition.keywords().size();
        if (keywords >= 5) {
            score += 30;
        } else if (keywords >= 3) {
            score += 20;
        }
        if (keywords < 5) {
            recommendations.add("Add more domain-specific keywords for better detection");
        }

        int rules = definition.requirementRules().size();
        if (rules >= 2) {
            score += 25;
        } else if (rules >= 1) {
            score += 15;
        }
        if (rules < 2) {
            recommendations.add("Define more requirement patterns for comprehensive extraction");
        }

        if (definition.stakeholders().size() >= 3) {
            score += 20;
        }
        if (definition.priorityScore() >= 3) {
            score += 15;
        } else {
            recommendations.add("Consider increasing priority score if domain is highly specific");
        }
        if (crossCutting != null && !crossCutting.isEmpty()) {
            score += 10;
        }
        return new PluginQuality(Math.min(score, 100), recommendations);
    }

    static List<String> crossCuttingConcerns(String lower) {
        List<String> concerns = new ArrayList<>();
        if (containsAny(lower, "security", "secure", "encryption", "auth")) concerns.add("security");
        if (containsAny(lower, "performance", "scalability", "load")) concerns.add("performance");
        if (containsAny(lower, "compliance", "regulation", "audit")) concerns.add("compliance");
        if (containsAny(lower, "backup", "disaster", "recovery")) concerns.add("disaster_recovery");
        return concerns;
    }

    private static Map.Entry<String, Double> bestPattern(String lower) {
        String bestDomain = "custom";
        double bestScore = 0.0;
        for (Map.Entry<String, List<String>> pattern : DOMAIN_PATTERNS.entrySet()) {
            long hits = pattern.getValue().stream().filter(lower::contains).count();
            double score = (double) hits / pattern.getValue().size();
            if (score > bestScore) {
                bestScore = score;
                bestDomain = pattern.getKey();
            }
        }
        return Map.entry(bestDomain, bestScore);
    }

    /** Most frequent distinctive words; ties keep first-occurrence order. */
    private static List<String> keyTerms(String lower) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        Matcher matcher = WORD.matcher(lower);
        while (matcher.find()) {
            String word = matcher.group();
            if (!STOP_WORDS.contains(word)) {
                frequency.merge(word, 1, Integer::sum);
            }
        }
        return frequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(KEY_TERM_COUNT)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static String chooseName(String domainHint, Map.Entry<String, Double> bestPattern,
                                     List<String> keyTerms, Set<String> taken) {
        List<String> candidates = new ArrayList<>();
        String hint = sanitize(domainHint);
        if (hint != null) candidates.add(hint);
        if (bestPattern.getValue() > 0) candidates.add(bestPattern.getKey());
        candidates.add(keyTerms.get(0));

        for (String candidate : candidates) {
            if (!taken.contains(candidate)) return candidate;
        }
        for (String candidate : candidates) {
            String suffixed = candidate + CUSTOM_SUFFIX;
            if (!taken.contains(suffixed)) return suffixed;
        }
        return null;
    }

    private static String sanitize(String hint) {
        if (hint == null) return null;
        String name = hint.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z]+", "_")
                .replaceAll("^_+|_+$", "");
        if (name.isEmpty() || GeneralDomainHandler.NAME.equals(name)) return null;
        return DomainDefinitionValidator.NAME_PATTERN.matcher(name).matches() ? name : null;
    }

    private static List<RequirementRule> requirementRules(String lower, String name) {
        String title = titleCase(name);
        List<RequirementRule> rules = new ArrayList<>();
        if (containsAny(lower, "manage", "track", "monitor")) {
            rules.add(new RequirementRule(List.of("manage", "track", "monitor"),
                    "Comprehensive " + title + " Management and Tracking System",
                    Priority.HIGH, RequirementCategory.FUNCTIONAL));
        }
        if (containsAny(lower, "integrate", "sync", "connect")) {
            rules.add(new RequirementRule(List.of("integrate", "sync", "connect"),
                    "External System Integration and Data Synchronization",
                    Priority.MEDIUM, RequirementCategory.FUNCTIONAL));
        }
        if (containsAny(lower, "report", "analytics", "dashboard")) {
            rules.add(new RequirementRule(List.of("report", "analytics", "dashboard"),
                    "Advanced Reporting and Analytics Dashboard",
                    Priority.MEDIUM, RequirementCategory.FUNCTIONAL));
        }
        if (containsAny(lower, "user", "interface", "ui", "ux")) {
            rules.add(new RequirementRule(List.of("user", "interface", "ui", "ux"),
                    "User Interface and Experience Implementation",
                    Priority.MEDIUM, RequirementCategory.FUNCTIONAL));
        }
        if (rules.isEmpty()) {
            rules.add(new RequirementRule(List.of(), "Core " + title + " System Implementation",
                    Priority.HIGH, RequirementCategory.FUNCTIONAL));
        }
        return rules;
    }

    private static List<String> stakeholders(String lower) {
        Set<String> stakeholders = new LinkedHashSet<>(List.of("End Users", "Development Team"));
        STAKEHOLDER_PATTERNS.forEach((pattern, names) -> {
            if (lower.contains(pattern)) stakeholders.addAll(names);
        });
        return List.copyOf(stakeholders);
    }

    private static String titleCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (String part : name.split("_")) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    private static boolean containsAny(String lower, String... terms) {
        return Arrays.stream(terms).anyMatch(lower::contains);
    }
}

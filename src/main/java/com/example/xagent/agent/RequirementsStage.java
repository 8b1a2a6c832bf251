package com.example.xagent.agent;

import com.example.xagent.handler.DomainHandler;
import com.example.xagent.handler.GeneralDomainHandler;
import com.example.xagent.model.AnalysisPacket;
import com.example.xagent.model.FeedbackInput;
import com.example.xagent.model.Priority;
import com.example.xagent.model.Requirement;
import com.example.xagent.model.RequirementCategory;
import com.example.xagent.model.RequirementDraft;
import com.example.xagent.model.RequirementsPacket;
import com.example.xagent.service.HandlerCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a resolved document into a bounded, deduplicated requirement list plus its
 * stakeholders, and re-derives that list under quality-gate feedback.
 * <p>
 * Explicit {@code REQ-<n>: <text>} markers in the document win over handler-based
 * extraction. Otherwise the domain handler proposes requirements; the generic set is
 * the last resort.
 */
@Service
public class RequirementsStage {

    private static final Logger log = LoggerFactory.getLogger(RequirementsStage.class);

    public static final int MAX_REQUIREMENTS = 8;
    static final int REDUCED_SCOPE_LIMIT = 5;
    static final int SIMPLIFIED_LIMIT = 6;
    static final int TASK_LIMITED_LIMIT = 3;
    static final int TITLE_LIMIT = 80;
    static final String SIMPLIFIED_PREFIX = "Basic ";

    private static final Pattern EXPLICIT_REQUIREMENT =
            Pattern.compile("(?<![A-Za-z0-9])REQ-(\\d+)[:\\s]+(.*?)(?=\\n|(?<![A-Za-z0-9])REQ-|$)", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<String> HIGH_PRIORITY_WORDS =
            List.of("critical", "must", "essential", "required", "mandatory");
    private static final List<String> LOW_PRIORITY_WORDS =
            List.of("nice", "optional", "future", "enhancement");

    private static final List<RequirementDraft> GENERIC_REQUIREMENTS = List.of(
            new RequirementDraft("Core System Implementation", Priority.HIGH, RequirementCategory.FUNCTIONAL),
            new RequirementDraft("User Interface and Experience Implementation", Priority.MEDIUM, RequirementCategory.FUNCTIONAL),
            new RequirementDraft("Data Management and Persistence", Priority.MEDIUM, RequirementCategory.FUNCTIONAL),
            new RequirementDraft("System Security and Access Control", Priority.HIGH, RequirementCategory.NON_FUNCTIONAL));

    private final HandlerCatalog catalog;

    public RequirementsStage(HandlerCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Extracts requirements and stakeholders for a resolved document.
     *
     * @param packet resolved domain and document content
     * @return at most {@value #MAX_REQUIREMENTS} requirements with IDs in extraction order
     */
    public RequirementsPacket extract(AnalysisPacket packet) {
        DomainHandler handler = handlerFor(packet.domain());
        String content = packet.content();

        List<Requirement> explicit = explicitRequirements(content);
        List<Requirement> requirements;
        if (!explicit.isEmpty()) {
            log.info("RequirementsStage: {} explicit requirement markers found, skipping handler extraction",
                    explicit.size());
            requirements = explicit;
        } else {
            requirements = handlerRequirements(handler, content);
        }

        Set<String> stakeholders = new LinkedHashSet<>(handler.extractStakeholders(content));
        log.info("RequirementsStage: {} requirements, {} stakeholders for domain '{}'",
                requirements.size(), stakeholders.size(), packet.domain());
        return new RequirementsPacket(packet.domain(), requirements, stakeholders, false);
    }

    /**
     * Re-extracts from the original content and narrows the result according to the
     * rejection reason. Surviving requirements keep their IDs.
     */
    public RequirementsPacket applyFeedback(AnalysisPacket packet, FeedbackInput feedback) {
        AnalysisPacket original = new AnalysisPacket(packet.domain(), packet.complexity(), feedback.originalContent());
        RequirementsPacket base = extract(original);
        List<Requirement> requirements = base.requirements();

        List<Requirement> adjusted = switch (feedback.reason()) {
            case REDUCE_SCOPE -> requirements.stream()
                    .filter(r -> r.priority() == Priority.HIGH)
                    .limit(REDUCED_SCOPE_LIMIT)
                    .toList();
            case TOO_COMPLEX -> requirements.stream()
                    .limit(SIMPLIFIED_LIMIT)
                    .map(r -> r.simplified(simplifiedTitle(r.title()), Priority.MEDIUM))
                    .toList();
            case TOO_MANY_TASKS -> requirements.stream()
                    .limit(TASK_LIMITED_LIMIT)
                    .toList();
            case TOO_MANY_REQUIREMENTS -> requirements.stream()
                    .limit(REDUCED_SCOPE_LIMIT)
                    .toList();
            case INSUFFICIENT_QUALITY -> requirements;
        };

        log.info("RequirementsStage: feedback '{}' applied, {} -> {} requirements",
                feedback.reason().code(), requirements.size(), adjusted.size());
        return base.withRequirements(adjusted, true);
    }

    private DomainHandler handlerFor(String domain) {
        if (domain == null || GeneralDomainHandler.NAME.equals(domain)) {
            return GeneralDomainHandler.INSTANCE;
        }
        return catalog.get(domain).orElseGet(() -> {
            log.warn("RequirementsStage: no handler for domain '{}', using '{}'", domain, GeneralDomainHandler.NAME);
            return GeneralDomainHandler.INSTANCE;
        });
    }

    /** Requirements stated as {@code REQ-<n>: text}; the document's numbers become the IDs. */
    List<Requirement> explicitRequirements(String content) {
        List<Requirement> requirements = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Set<String> seenTitles = new HashSet<>();

        Matcher matcher = EXPLICIT_REQUIREMENT.matcher(content);
        while (matcher.find() && requirements.size() < MAX_REQUIREMENTS) {
            String text = matcher.group(2).trim();
            if (text.isEmpty()) continue;
            String id = markerId(matcher.group(1));
            String title = truncate(text);
            if (!seenIds.add(id) || !seenTitles.add(normalize(title))) continue;
            requirements.add(new Requirement(id, title, detectPriority(text), RequirementCategory.FUNCTIONAL));
        }
        return requirements;
    }

    /** {@code 7 -> REQ-007}; numbers of any length are kept as written, minus leading zeros. */
    static String markerId(String digits) {
        return "REQ-%03d".formatted(new BigInteger(digits));
    }

    private List<Requirement> handlerRequirements(DomainHandler handler, String content) {
        List<RequirementDraft> drafts = new ArrayList<>(handler.extractRequirements(content));
        drafts.addAll(handler.crossCuttingRequirements(content));
        if (drafts.isEmpty()) {
            log.info("RequirementsStage: handler '{}' proposed nothing, using the generic requirement set",
                    handler.name());
            drafts = GENERIC_REQUIREMENTS;
        }

        List<Requirement> requirements = new ArrayList<>();
        Set<String> seenTitles = new HashSet<>();
        for (RequirementDraft draft : drafts) {
            if (requirements.size() == MAX_REQUIREMENTS) break;
            if (draft.title() == null || draft.title().isBlank()) continue;
            String title = truncate(draft.title().trim());
            if (!seenTitles.add(normalize(title))) continue;
            requirements.add(new Requirement(Requirement.formatId(requirements.size() + 1),
                    title, draft.priority(), draft.category()));
        }
        return requirements;
    }

    static String normalize(String title) {
        return WHITESPACE.matcher(title.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    static Priority detectPriority(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (HIGH_PRIORITY_WORDS.stream().anyMatch(lower::contains)) return Priority.HIGH;
        if (LOW_PRIORITY_WORDS.stream().anyMatch(lower::contains)) return Priority.LOW;
        return Priority.MEDIUM;
    }

    private static String simplifiedTitle(String title) {
        return title.startsWith(SIMPLIFIED_PREFIX) ? title : SIMPLIFIED_PREFIX + title;
    }

    private static String truncate(String text) {
        return text.length() > TITLE_LIMIT ? text.substring(0, TITLE_LIMIT) + "..." : text;
    }
}

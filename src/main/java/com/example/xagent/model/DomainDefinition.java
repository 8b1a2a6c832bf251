package com.example.xagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Declarative description of a domain handler. Built-in handlers ship as JSON
 * definitions on the classpath; synthesized handlers are produced in this shape and
 * persisted to the plugin directory.
 *
 * @param name              Unique domain name ({@code ^[a-z_]+$})
 * @param keywords          Detection keywords (lower case, may be multi-word phrases)
 * @param priorityScore     Specificity used to weight detection confidence, 1..5
 * @param requirementRules  Domain requirements, each emitted when one of its triggers occurs
 * @param stakeholders      Stakeholders always reported for the domain
 * @param stakeholderRules  Stakeholders reported when one of their triggers occurs
 * @param crossCuttingRules Cross-cutting requirements; null to use the default set
 * @param customCreated     True for synthesized handlers
 * @param creationCost      Reported synthesis cost (0 for built-ins)
 * @param createdTimestamp  Synthesis time (null for built-ins)
 * @param sourcePath        File the definition was persisted to (null for built-ins)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DomainDefinition(
        String name,
        List<String> keywords,
        int priorityScore,
        List<RequirementRule> requirementRules,
        List<String> stakeholders,
        List<StakeholderRule> stakeholderRules,
        List<RequirementRule> crossCuttingRules,
        boolean customCreated,
        double creationCost,
        Instant createdTimestamp,
        String sourcePath
) {
    public DomainDefinition {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        requirementRules = requirementRules != null ? List.copyOf(requirementRules) : List.of();
        stakeholders = stakeholders != null ? List.copyOf(stakeholders) : List.of();
        stakeholderRules = stakeholderRules != null ? List.copyOf(stakeholderRules) : List.of();
        crossCuttingRules = crossCuttingRules != null ? List.copyOf(crossCuttingRules) : null;
    }

    /** Marks the definition as synthesized, stamping cost, time and file location. */
    public DomainDefinition withProvenance(double cost, Instant created, String path) {
        return new DomainDefinition(name, keywords, priorityScore, requirementRules, stakeholders,
                stakeholderRules, crossCuttingRules, true, cost, created, path);
    }

    /**
     * A requirement emitted when the content contains any trigger term.
     * An empty trigger list means the rule always applies.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RequirementRule(
            List<String> triggers,
            String title,
            Priority priority,
            RequirementCategory category
    ) {
        public RequirementRule {
            triggers = triggers != null ? List.copyOf(triggers) : List.of();
        }
    }

    /** Stakeholders added when the content contains any trigger term. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StakeholderRule(
            List<String> triggers,
            List<String> stakeholders
    ) {
        public StakeholderRule {
            triggers = triggers != null ? List.copyOf(triggers) : List.of();
            stakeholders = stakeholders != null ? List.copyOf(stakeholders) : List.of();
        }
    }
}

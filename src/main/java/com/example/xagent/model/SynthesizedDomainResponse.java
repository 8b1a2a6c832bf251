package com.example.xagent.model;

import com.example.xagent.model.DomainDefinition.RequirementRule;

import java.util.List;

/**
 * Structured domain proposal returned by the language model.
 *
 * @param name             Domain name, lowercase with underscores
 * @param keywords         Detection keywords
 * @param priorityScore    Specificity 1..5
 * @param requirementRules Requirement rules with trigger terms
 * @param stakeholders     Stakeholders of the domain
 */
public record SynthesizedDomainResponse(
        String name,
        List<String> keywords,
        int priorityScore,
        List<RequirementRule> requirementRules,
        List<String> stakeholders
) {
    public DomainDefinition toDefinition() {
        return new DomainDefinition(name, keywords, priorityScore, requirementRules, stakeholders,
                List.of(), null, false, 0.0, null, null);
    }
}

package com.example.xagent.handler;

import com.example.xagent.model.DomainDefinition;
import com.example.xagent.model.DomainDefinition.RequirementRule;
import com.example.xagent.model.DomainDefinition.StakeholderRule;
import com.example.xagent.model.RequirementDraft;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Domain handler driven by a {@link DomainDefinition}. Used for the built-in domains
 * and for every synthesized one.
 */
public class DefinitionDomainHandler implements DomainHandler {

    private final DomainDefinition definition;
    private final List<String> keywords;

    public DefinitionDomainHandler(DomainDefinition definition) {
        this.definition = definition;
        this.keywords = definition.keywords().stream()
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public DomainDefinition definition() {
        return definition;
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public List<String> keywords() {
        return keywords;
    }

    @Override
    public int priorityScore() {
        return definition.priorityScore();
    }

    @Override
    public List<RequirementDraft> extractRequirements(String content) {
        return applyRules(definition.requirementRules(), content);
    }

    @Override
    public List<RequirementDraft> crossCuttingRequirements(String content) {
        if (definition.crossCuttingRules() == null) {
            return DomainHandler.super.crossCuttingRequirements(content);
        }
        return applyRules(definition.crossCuttingRules(), content);
    }

    @Override
    public List<String> extractStakeholders(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        Set<String> stakeholders = new LinkedHashSet<>(definition.stakeholders());
        for (StakeholderRule rule : definition.stakeholderRules()) {
            if (CrossCuttingConcerns.containsAny(lower, rule.triggers())) {
                stakeholders.addAll(rule.stakeholders());
            }
        }
        if (stakeholders.isEmpty()) {
            return DomainHandler.super.extractStakeholders(content);
        }
        return List.copyOf(stakeholders);
    }

    private static List<RequirementDraft> applyRules(List<RequirementRule> rules, String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        List<RequirementDraft> drafts = new ArrayList<>();
        for (RequirementRule rule : rules) {
            if (rule.triggers().isEmpty() || CrossCuttingConcerns.containsAny(lower, rule.triggers())) {
                drafts.add(new RequirementDraft(rule.title(), rule.priority(), rule.category()));
            }
        }
        return drafts;
    }

    @Override
    public String toString() {
        return "DefinitionDomainHandler[" + definition.name() + "]";
    }
}

package com.example.xagent.handler;

import com.example.xagent.model.RequirementDraft;

import java.util.List;

/**
 * Sentinel handler used when no domain matches and synthesis is unavailable.
 * Extracts nothing, so the requirements stage falls back to its generic set.
 */
public final class GeneralDomainHandler implements DomainHandler {

    public static final String NAME = "general";

    public static final GeneralDomainHandler INSTANCE = new GeneralDomainHandler();

    private GeneralDomainHandler() {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> keywords() {
        return List.of();
    }

    @Override
    public int priorityScore() {
        return 1;
    }

    @Override
    public List<RequirementDraft> extractRequirements(String content) {
        return List.of();
    }

    @Override
    public List<RequirementDraft> crossCuttingRequirements(String content) {
        return List.of();
    }

    @Override
    public double detectConfidence(String content) {
        return 0.0;
    }
}

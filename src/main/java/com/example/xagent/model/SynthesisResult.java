package com.example.xagent.model;

/**
 * Result of a plugin synthesis attempt: either a definition with its cost, or an error.
 */
public record SynthesisResult(
        DomainDefinition definition,
        double cost,
        String error
) {
    public static SynthesisResult success(DomainDefinition definition, double cost) {
        return new SynthesisResult(definition, cost, null);
    }

    public static SynthesisResult failure(String error) {
        return new SynthesisResult(null, 0.0, error);
    }

    public boolean succeeded() {
        return definition != null && error == null;
    }
}

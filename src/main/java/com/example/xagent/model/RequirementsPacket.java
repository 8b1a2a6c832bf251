package com.example.xagent.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of the requirements stage.
 *
 * @param domain          Domain the requirements were extracted for
 * @param requirements    Insertion-ordered, deduplicated requirements
 * @param stakeholders    Stakeholders (set semantics)
 * @param feedbackApplied Whether a quality-gate feedback transform was applied
 */
public record RequirementsPacket(
        String domain,
        List<Requirement> requirements,
        Set<String> stakeholders,
        boolean feedbackApplied
) {
    public RequirementsPacket {
        requirements = requirements != null ? List.copyOf(requirements) : List.of();
        stakeholders = stakeholders != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(stakeholders)) : Set.of();
    }

    public RequirementsPacket withRequirements(List<Requirement> newRequirements, boolean applied) {
        return new RequirementsPacket(domain, newRequirements, stakeholders, applied);
    }
}

package com.example.xagent.model;

/**
 * A requirement as proposed by a domain handler, before the requirements stage
 * deduplicates it and assigns an ID.
 */
public record RequirementDraft(
        String title,
        Priority priority,
        RequirementCategory category
) {
    public RequirementDraft {
        if (priority == null) priority = Priority.MEDIUM;
        if (category == null) category = RequirementCategory.FUNCTIONAL;
    }
}

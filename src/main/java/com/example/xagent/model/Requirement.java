package com.example.xagent.model;

/**
 * A single requirement handed from the requirements stage to the task stage.
 *
 * @param id       Identifier in {@code REQ-NNN} format, unique within one packet
 * @param title    Requirement title
 * @param priority Priority (drives story-point bonus and scope reduction)
 * @param category Functional or non-functional
 */
public record Requirement(
        String id,
        String title,
        Priority priority,
        RequirementCategory category
) {
    public Requirement {
        if (priority == null) priority = Priority.MEDIUM;
        if (category == null) category = RequirementCategory.FUNCTIONAL;
    }

    /** Formats a sequence number as a requirement ID ({@code 7 -> REQ-007}). */
    public static String formatId(int number) {
        return "REQ-%03d".formatted(number);
    }

    /** Creates a copy with a new title and priority, keeping ID and category. */
    public Requirement simplified(String newTitle, Priority newPriority) {
        return new Requirement(id, newTitle, newPriority, category);
    }
}

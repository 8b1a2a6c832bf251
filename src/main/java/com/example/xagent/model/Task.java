package com.example.xagent.model;

/**
 * A unit of work in the task plan.
 *
 * @param id            Identifier in {@code TASK-NNN} format
 * @param requirementId Owning requirement, or {@link #DOMAIN_REQUIREMENT} for domain-wide tasks
 * @param title         Task title
 * @param storyPoints   Estimate in story points
 * @param hours         Estimate in hours
 * @param priority      Priority inherited from the requirement (high for domain tasks)
 */
public record Task(
        String id,
        String requirementId,
        String title,
        int storyPoints,
        int hours,
        Priority priority
) {
    public static final String DOMAIN_REQUIREMENT = "DOMAIN";

    public static String formatId(int number) {
        return "TASK-%03d".formatted(number);
    }

    public boolean isDomainTask() {
        return DOMAIN_REQUIREMENT.equals(requirementId);
    }
}

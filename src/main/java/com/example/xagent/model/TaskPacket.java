package com.example.xagent.model;

import java.util.List;

/**
 * Output of the task stage with its aggregate metrics.
 *
 * @param tasks          All tasks in creation order
 * @param totalTasks     Number of tasks
 * @param storyPoints    Sum of task story points
 * @param expansionRatio Tasks per requirement ({@code totalTasks / max(requirementCount, 1)})
 */
public record TaskPacket(
        List<Task> tasks,
        int totalTasks,
        int storyPoints,
        double expansionRatio
) {
    public TaskPacket {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    /** Computes the aggregate metrics from the task list. */
    public static TaskPacket of(List<Task> tasks, int requirementCount) {
        int points = tasks.stream().mapToInt(Task::storyPoints).sum();
        double ratio = (double) tasks.size() / Math.max(requirementCount, 1);
        return new TaskPacket(tasks, tasks.size(), points, ratio);
    }
}

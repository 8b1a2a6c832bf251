package com.example.xagent.agent;

import com.example.xagent.model.Priority;
import com.example.xagent.model.Requirement;
import com.example.xagent.model.RequirementsPacket;
import com.example.xagent.model.Task;
import com.example.xagent.model.TaskPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Expands requirements into a task plan.
 * <p>
 * Every requirement yields Design, Implement, Test and Document tasks, in that order.
 * Implement is worth 3 story points and the others 2; high-priority requirements add one
 * point to each of their tasks. Some domains append fixed domain-wide tasks.
 */
@Service
public class TaskStage {

    private static final Logger log = LoggerFactory.getLogger(TaskStage.class);

    static final double HOURS_PER_POINT = 3.5;

    private enum Phase {
        DESIGN("Design", 2),
        IMPLEMENT("Implement", 3),
        TEST("Test", 2),
        DOCUMENT("Document", 2);

        private final String verb;
        private final int basePoints;

        Phase(String verb, int basePoints) {
            this.verb = verb;
            this.basePoints = basePoints;
        }
    }

    private record DomainTask(String title, int storyPoints) {}

    private static final Map<String, List<DomainTask>> DOMAIN_TASKS = Map.of(
            "enterprise", List.of(
                    new DomainTask("Enterprise Security Infrastructure Setup", 5),
                    new DomainTask("Compliance Review and Audit Preparation", 3)),
            "healthcare", List.of(
                    new DomainTask("HIPAA Compliance Assessment", 3),
                    new DomainTask("Protected Health Information Encryption Setup", 5)),
            "fintech", List.of(
                    new DomainTask("PCI-DSS Compliance Assessment", 3),
                    new DomainTask("Fraud Monitoring Setup", 5)),
            "ecommerce", List.of(
                    new DomainTask("Payment Gateway Sandbox Integration", 3)),
            "mobile_app", List.of(
                    new DomainTask("App Store Release Preparation", 2)),
            "gaming_studio_management", List.of(
                    new DomainTask("Anti-Cheat Baseline Setup", 3)),
            "real_estate", List.of(
                    new DomainTask("Listing Data Feed Onboarding", 3)));

    /**
     * Builds the task plan for a requirements packet.
     * Task IDs run from {@code TASK-001} in creation order: requirement tasks first,
     * domain-wide tasks last.
     */
    public TaskPacket decompose(RequirementsPacket packet) {
        List<Task> tasks = new ArrayList<>();

        for (Requirement requirement : packet.requirements()) {
            int bonus = requirement.priority() == Priority.HIGH ? 1 : 0;
            for (Phase phase : Phase.values()) {
                int points = phase.basePoints + bonus;
                tasks.add(new Task(Task.formatId(tasks.size() + 1), requirement.id(),
                        phase.verb + ": " + requirement.title(), points, hours(points), requirement.priority()));
            }
        }

        for (DomainTask domainTask : DOMAIN_TASKS.getOrDefault(packet.domain(), List.of())) {
            tasks.add(new Task(Task.formatId(tasks.size() + 1), Task.DOMAIN_REQUIREMENT,
                    domainTask.title(), domainTask.storyPoints(), hours(domainTask.storyPoints()), Priority.HIGH));
        }

        TaskPacket result = TaskPacket.of(tasks, packet.requirements().size());
        log.info("TaskStage: {} tasks, {} story points, expansion ratio {}",
                result.totalTasks(), result.storyPoints(), "%.2f".formatted(result.expansionRatio()));
        return result;
    }

    static int hours(int storyPoints) {
        return (int) Math.floor(storyPoints * HOURS_PER_POINT);
    }
}

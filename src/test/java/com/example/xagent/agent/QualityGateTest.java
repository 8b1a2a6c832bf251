package com.example.xagent.agent;

import com.example.xagent.model.ApprovalDecision;
import com.example.xagent.model.FeedbackReason;
import com.example.xagent.model.Priority;
import com.example.xagent.model.RiskLevel;
import com.example.xagent.model.Task;
import com.example.xagent.model.TaskPacket;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityGateTest {

    private final QualityGate gate = new QualityGate();

    private static TaskPacket plan(int taskCount, int pointsPerTask, int requirementCount) {
        List<Task> tasks = new ArrayList<>();
        for (int i = 1; i <= taskCount; i++) {
            tasks.add(new Task(Task.formatId(i), "REQ-001", "Task " + i, pointsPerTask,
                    TaskStage.hours(pointsPerTask), Priority.MEDIUM));
        }
        return TaskPacket.of(tasks, requirementCount);
    }

    @Test
    void approvesModestPlan() {
        ApprovalDecision decision = gate.evaluate(plan(12, 2, 3), 3);

        assertThat(decision.approved()).isTrue();
        assertThat(decision.qualityScore()).isEqualTo(100.0);
        assertThat(decision.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(decision.feedback()).isNull();
    }

    @Test
    void largePlanIsHighRiskAndAsksToReduceScope() {
        // 30 tasks worth 120 story points
        ApprovalDecision decision = gate.evaluate(plan(30, 4, 8), 8);

        assertThat(decision.approved()).isFalse();
        assertThat(decision.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(decision.qualityScore()).isEqualTo(75.0);
        assertThat(decision.feedback()).isEqualTo(FeedbackReason.REDUCE_SCOPE);
    }

    @Test
    void tooManyTasksIsReportedBeforeRatio() {
        ApprovalDecision decision = gate.evaluate(plan(60, 1, 2), 2);

        assertThat(decision.approved()).isFalse();
        assertThat(decision.feedback()).isEqualTo(FeedbackReason.TOO_MANY_TASKS);
    }

    @Test
    void overDecompositionIsTooComplex() {
        ApprovalDecision decision = gate.evaluate(plan(40, 1, 2), 2);

        assertThat(decision.approved()).isFalse();
        assertThat(decision.qualityScore()).isEqualTo(50.0);
        assertThat(decision.feedback()).isEqualTo(FeedbackReason.TOO_COMPLEX);
    }

    @Test
    void mediumRiskPlanCanStillBeApproved() {
        ApprovalDecision decision = gate.evaluate(plan(20, 4, 5), 5);

        assertThat(decision.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(decision.approved()).isTrue();
    }

    @Test
    void approvalAlwaysMeetsScoreAndRiskThresholds() {
        for (int tasks = 0; tasks <= 70; tasks += 7) {
            for (int points = 1; points <= 5; points++) {
                for (int requirements = 0; requirements <= 10; requirements += 2) {
                    ApprovalDecision decision = gate.evaluate(plan(tasks, points, requirements), requirements);
                    if (decision.approved()) {
                        assertThat(decision.qualityScore()).isGreaterThanOrEqualTo(75.0);
                        assertThat(decision.riskLevel()).isNotEqualTo(RiskLevel.HIGH);
                    } else {
                        assertThat(decision.feedback()).isNotNull();
                    }
                }
            }
        }
    }

    @Test
    void riskLevelBoundaries() {
        assertThat(QualityGate.riskLevel(60)).isEqualTo(RiskLevel.LOW);
        assertThat(QualityGate.riskLevel(61)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(QualityGate.riskLevel(100)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(QualityGate.riskLevel(101)).isEqualTo(RiskLevel.HIGH);
    }
}

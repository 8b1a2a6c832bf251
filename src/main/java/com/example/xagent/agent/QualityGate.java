package com.example.xagent.agent;

import com.example.xagent.model.ApprovalDecision;
import com.example.xagent.model.FeedbackReason;
import com.example.xagent.model.RiskLevel;
import com.example.xagent.model.TaskPacket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Approval checkpoint for a task plan.
 * <p>
 * Four independent checks each contribute 25 points to the quality score. A plan is
 * approved with a score of at least 75 and a risk level below high. A rejection carries
 * exactly one feedback reason, the first that applies in this order: story points,
 * task count, expansion ratio, requirement count, generic.
 */
@Service
public class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    static final int MAX_TASKS = 50;
    static final int MAX_STORY_POINTS = 80;
    static final int MIN_REQUIREMENTS = 3;
    static final double MAX_EXPANSION_RATIO = 15.0;
    static final int HIGH_RISK_POINTS = 100;
    static final int MEDIUM_RISK_POINTS = 60;
    static final double APPROVAL_SCORE = 75.0;

    public ApprovalDecision evaluate(TaskPacket packet, int requirementCount) {
        boolean reasonableTaskCount = packet.totalTasks() <= MAX_TASKS;
        boolean manageableStoryPoints = packet.storyPoints() <= MAX_STORY_POINTS;
        boolean adequateScope = requirementCount >= MIN_REQUIREMENTS;
        boolean goodTaskRatio = packet.expansionRatio() <= MAX_EXPANSION_RATIO;

        int passed = count(reasonableTaskCount, manageableStoryPoints, adequateScope, goodTaskRatio);
        double qualityScore = 100.0 * passed / 4;
        RiskLevel risk = riskLevel(packet.storyPoints());
        boolean approved = qualityScore >= APPROVAL_SCORE && risk != RiskLevel.HIGH;

        FeedbackReason feedback = null;
        if (!approved) {
            if (!manageableStoryPoints) {
                feedback = FeedbackReason.REDUCE_SCOPE;
            } else if (!reasonableTaskCount) {
                feedback = FeedbackReason.TOO_MANY_TASKS;
            } else if (!goodTaskRatio) {
                feedback = FeedbackReason.TOO_COMPLEX;
            } else if (requirementCount > RequirementsStage.MAX_REQUIREMENTS) {
                feedback = FeedbackReason.TOO_MANY_REQUIREMENTS;
            } else {
                feedback = FeedbackReason.INSUFFICIENT_QUALITY;
            }
        }

        log.info("QualityGate: score {} ({}/4 checks), risk {}, {}",
                qualityScore, passed, risk.code(), approved ? "APPROVED" : "REJECTED: " + feedback.code());
        return new ApprovalDecision(approved, qualityScore, risk, feedback);
    }

    static RiskLevel riskLevel(int storyPoints) {
        if (storyPoints > HIGH_RISK_POINTS) return RiskLevel.HIGH;
        if (storyPoints > MEDIUM_RISK_POINTS) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    private static int count(boolean... checks) {
        int n = 0;
        for (boolean check : checks) {
            if (check) n++;
        }
        return n;
    }
}

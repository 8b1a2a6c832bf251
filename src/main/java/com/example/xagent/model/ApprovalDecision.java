package com.example.xagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Quality gate verdict.
 *
 * @param approved     Whether the plan passed the gate
 * @param qualityScore Share of passed checks, 0..100
 * @param riskLevel    Risk derived from total story points
 * @param feedback     Categorized rejection reason; null when approved
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalDecision(
        boolean approved,
        double qualityScore,
        RiskLevel riskLevel,
        FeedbackReason feedback
) {
    public ApprovalDecision {
        if (!approved && feedback == null) {
            throw new IllegalArgumentException("A rejected decision must carry a feedback reason");
        }
    }
}

package com.example.xagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of categorized rejection causes emitted by the quality gate and
 * consumed by the requirements stage on the next iteration.
 * Declaration order is the gate's reporting priority.
 */
public enum FeedbackReason {

    /** Story points above the manageable limit: keep only high-priority requirements. */
    REDUCE_SCOPE("reduce_scope"),

    /** Too many tasks in the plan: cap the requirement count hard. */
    TOO_MANY_TASKS("too_many_tasks"),

    /** Over-decomposition (tasks per requirement too high): simplify requirements. */
    TOO_COMPLEX("too_complex"),

    /** More requirements than the stage is allowed to hand over. */
    TOO_MANY_REQUIREMENTS("too_many_requirements"),

    /** None of the specific checks explains the rejection. */
    INSUFFICIENT_QUALITY("insufficient_quality");

    private final String code;

    FeedbackReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}

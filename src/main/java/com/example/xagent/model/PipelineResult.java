package com.example.xagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What a caller gets back from a pipeline run. Exactly one of three shapes:
 * <ul>
 *   <li>{@code APPROVED}: domain, requirements, tasks and approval</li>
 *   <li>{@code REJECTED}: the same plus the final feedback reason and the iteration count</li>
 *   <li>{@code ERROR}: the malformed-input reason only</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResult(
        PipelineStatus status,
        String domain,
        Boolean synthesized,
        Double synthesisCost,
        RequirementsPacket requirements,
        TaskPacket tasks,
        ApprovalDecision approval,
        Integer iterations,
        FeedbackReason feedback,
        String error,
        @JsonIgnore PipelineTimings timings
) {
    public static PipelineResult approved(Resolution resolution, RequirementsPacket requirements,
                                          TaskPacket tasks, ApprovalDecision approval,
                                          int iterations, PipelineTimings timings) {
        return new PipelineResult(PipelineStatus.APPROVED, resolution.domainName(),
                resolution.wasSynthesized(), resolution.cost(), requirements, tasks, approval,
                iterations, null, null, timings);
    }

    public static PipelineResult rejected(Resolution resolution, RequirementsPacket requirements,
                                          TaskPacket tasks, ApprovalDecision approval,
                                          int iterations, PipelineTimings timings) {
        return new PipelineResult(PipelineStatus.REJECTED, resolution.domainName(),
                resolution.wasSynthesized(), resolution.cost(), requirements, tasks, approval,
                iterations, approval.feedback(), null, timings);
    }

    public static PipelineResult error(String reason) {
        return new PipelineResult(PipelineStatus.ERROR, null, null, null, null, null, null,
                null, null, reason, null);
    }
}

package com.example.xagent.orchestrator;

import com.example.xagent.agent.QualityGate;
import com.example.xagent.agent.RequirementsStage;
import com.example.xagent.agent.TaskStage;
import com.example.xagent.config.PipelineProperties;
import com.example.xagent.model.AnalysisPacket;
import com.example.xagent.model.ApprovalDecision;
import com.example.xagent.model.DocumentInput;
import com.example.xagent.model.FeedbackInput;
import com.example.xagent.model.IngressResult;
import com.example.xagent.model.PipelineResult;
import com.example.xagent.model.PipelineTimings;
import com.example.xagent.model.RequirementsPacket;
import com.example.xagent.model.Resolution;
import com.example.xagent.model.TaskPacket;
import com.example.xagent.service.DocumentIngressService;
import com.example.xagent.service.DomainResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Refinement pipeline orchestrator.
 * <p>
 * States: Resolving, then Iterating(k) until Approved or Rejected.
 * <ol>
 *   <li>Ingress validation (malformed input ends the run with an error)</li>
 *   <li>Domain resolution (may synthesize a new handler)</li>
 *   <li>Up to {@code maxIterations} rounds of Requirements, Tasks and Quality Gate, feeding
 *       each rejection reason back into the next requirements extraction</li>
 * </ol>
 * Runs hold no state between calls; the handler catalog is the only shared resource.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final DocumentIngressService ingressService;
    private final DomainResolver domainResolver;
    private final RequirementsStage requirementsStage;
    private final TaskStage taskStage;
    private final QualityGate qualityGate;
    private final int maxIterations;

    public PipelineOrchestrator(DocumentIngressService ingressService,
                                DomainResolver domainResolver,
                                RequirementsStage requirementsStage,
                                TaskStage taskStage,
                                QualityGate qualityGate,
                                PipelineProperties properties) {
        this.ingressService = ingressService;
        this.domainResolver = domainResolver;
        this.requirementsStage = requirementsStage;
        this.taskStage = taskStage;
        this.qualityGate = qualityGate;
        this.maxIterations = properties.orchestrator().maxIterations();
    }

    public PipelineResult run(DocumentInput input) {
        IngressResult ingress = ingressService.parse(input);
        if (ingress.isMalformed()) {
            return PipelineResult.error(ingress.error());
        }
        DocumentInput document = ingress.document();
        String content = document.content();

        log.info("═══════════════════════════════════════════════");
        log.info("Starting refinement pipeline ({} characters, hint '{}')", content.length(), document.domainHint());
        log.info("═══════════════════════════════════════════════");

        // ── Resolving ──
        long start = System.nanoTime();
        Resolution resolution = domainResolver.resolve(content, document.domainHint());
        AnalysisPacket packet = AnalysisPacket.of(resolution.domainName(), content);
        long resolved = System.nanoTime();
        log.info("[resolve] Domain '{}' (score {}, synthesized={}), complexity {}/{}",
                resolution.domainName(), "%.3f".formatted(resolution.score()), resolution.wasSynthesized(),
                packet.complexity(), AnalysisPacket.MAX_COMPLEXITY);

        // ── Iterating(k) ──
        RequirementsPacket requirements = null;
        TaskPacket tasks = null;
        ApprovalDecision decision = null;
        int iteration = 0;
        while (iteration < maxIterations) {
            log.info("[iteration {}/{}] Requirements → Tasks → Quality Gate", iteration + 1, maxIterations);

            requirements = decision == null
                    ? requirementsStage.extract(packet)
                    : requirementsStage.applyFeedback(packet, new FeedbackInput(decision.feedback(), content));
            tasks = taskStage.decompose(requirements);
            decision = qualityGate.evaluate(tasks, requirements.requirements().size());
            iteration++;

            if (decision.approved()) {
                PipelineTimings timings = timings(start, resolved);
                log.info("Pipeline APPROVED after {} iteration(s): {} requirements, {} tasks, {} story points",
                        iteration, requirements.requirements().size(), tasks.totalTasks(), tasks.storyPoints());
                return PipelineResult.approved(resolution, requirements, tasks, decision, iteration, timings);
            }
            log.info("[iteration {}/{}] Rejected: {}", iteration, maxIterations, decision.feedback().code());
        }

        PipelineTimings timings = timings(start, resolved);
        log.info("Pipeline REJECTED after {} iteration(s), last feedback '{}'",
                iteration, decision.feedback().code());
        return PipelineResult.rejected(resolution, requirements, tasks, decision, iteration, timings);
    }

    private static PipelineTimings timings(long start, long resolved) {
        long end = System.nanoTime();
        return new PipelineTimings((resolved - start) / 1e9, (end - resolved) / 1e9);
    }
}

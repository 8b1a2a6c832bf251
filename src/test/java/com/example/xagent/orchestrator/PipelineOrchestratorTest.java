package com.example.xagent.orchestrator;

import com.example.xagent.agent.QualityGate;
import com.example.xagent.agent.RequirementsStage;
import com.example.xagent.agent.TaskStage;
import com.example.xagent.config.PipelineProperties;
import com.example.xagent.handler.GeneralDomainHandler;
import com.example.xagent.model.ApprovalDecision;
import com.example.xagent.model.DocumentInput;
import com.example.xagent.model.FeedbackReason;
import com.example.xagent.model.PipelineResult;
import com.example.xagent.model.PipelineStatus;
import com.example.xagent.model.Priority;
import com.example.xagent.model.Resolution;
import com.example.xagent.model.RiskLevel;
import com.example.xagent.service.DocumentIngressService;
import com.example.xagent.service.DomainResolver;
import com.example.xagent.service.HandlerCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the refinement loop, with resolution and the quality gate mocked.
 */
@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final String VAGUE_CONTENT = "Something quite vague.";

    private static final ApprovalDecision APPROVED = new ApprovalDecision(true, 100.0, RiskLevel.LOW, null);

    @Mock
    private DomainResolver domainResolver;

    @Mock
    private QualityGate qualityGate;

    @Mock
    private HandlerCatalog catalog;

    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = orchestrator(PipelineProperties.defaults());
    }

    private PipelineOrchestrator orchestrator(PipelineProperties properties) {
        return new PipelineOrchestrator(new DocumentIngressService(properties), domainResolver,
                new RequirementsStage(catalog), new TaskStage(), qualityGate, properties);
    }

    private static ApprovalDecision rejected(FeedbackReason reason) {
        return new ApprovalDecision(false, 50.0, RiskLevel.LOW, reason);
    }

    private void resolvesToGeneral() {
        when(domainResolver.resolve(anyString(), any()))
                .thenReturn(new Resolution(GeneralDomainHandler.INSTANCE, GeneralDomainHandler.NAME, 0.0, false, 0.0));
    }

    @Test
    void stopsAfterMaxIterationsWhenNeverApproved() {
        resolvesToGeneral();
        when(qualityGate.evaluate(any(), anyInt())).thenReturn(rejected(FeedbackReason.INSUFFICIENT_QUALITY));

        PipelineResult result = orchestrator.run(new DocumentInput(VAGUE_CONTENT, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.REJECTED);
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.feedback()).isEqualTo(FeedbackReason.INSUFFICIENT_QUALITY);
        assertThat(result.requirements().feedbackApplied()).isTrue();
        verify(qualityGate, times(3)).evaluate(any(), anyInt());
    }

    @Test
    void appliesFeedbackAndStopsOnApproval() {
        resolvesToGeneral();
        when(qualityGate.evaluate(any(), anyInt()))
                .thenReturn(rejected(FeedbackReason.REDUCE_SCOPE))
                .thenReturn(APPROVED);

        PipelineResult result = orchestrator.run(new DocumentInput(VAGUE_CONTENT, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.APPROVED);
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(result.feedback()).isNull();
        assertThat(result.domain()).isEqualTo(GeneralDomainHandler.NAME);
        assertThat(result.requirements().feedbackApplied()).isTrue();
        assertThat(result.requirements().requirements())
                .hasSize(2)
                .allSatisfy(r -> assertThat(r.priority()).isEqualTo(Priority.HIGH));
        assertThat(result.tasks().totalTasks()).isEqualTo(8);
        assertThat(result.timings()).isNotNull();
        verify(qualityGate, times(2)).evaluate(any(), anyInt());
    }

    @Test
    void firstIterationUsesPlainExtraction() {
        resolvesToGeneral();
        when(qualityGate.evaluate(any(), anyInt())).thenReturn(APPROVED);

        PipelineResult result = orchestrator.run(new DocumentInput(VAGUE_CONTENT, "general"));

        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.requirements().feedbackApplied()).isFalse();
        assertThat(result.requirements().requirements()).hasSize(4);
        assertThat(result.synthesized()).isFalse();
    }

    @Test
    void iterationLimitIsConfigurable() {
        resolvesToGeneral();
        when(qualityGate.evaluate(any(), anyInt())).thenReturn(rejected(FeedbackReason.TOO_COMPLEX));
        PipelineOrchestrator single = orchestrator(new PipelineProperties(null, null, null,
                new PipelineProperties.Orchestrator(1), null));

        PipelineResult result = single.run(new DocumentInput(VAGUE_CONTENT, null));

        assertThat(result.status()).isEqualTo(PipelineStatus.REJECTED);
        assertThat(result.iterations()).isEqualTo(1);
        verify(qualityGate, times(1)).evaluate(any(), anyInt());
    }

    @Test
    void malformedInputEndsWithErrorBeforeResolution() {
        PipelineResult blank = orchestrator.run(new DocumentInput("   ", null));
        PipelineResult missing = orchestrator.run(null);
        PipelineResult binary = orchestrator.run(new DocumentInput("abc\u0000def", null));

        assertThat(blank.status()).isEqualTo(PipelineStatus.ERROR);
        assertThat(blank.error()).isEqualTo("Empty document");
        assertThat(missing.status()).isEqualTo(PipelineStatus.ERROR);
        assertThat(binary.status()).isEqualTo(PipelineStatus.ERROR);
        assertThat(binary.iterations()).isNull();
        verifyNoInteractions(domainResolver, qualityGate);
    }
}

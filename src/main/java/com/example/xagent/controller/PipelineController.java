package com.example.xagent.controller;

import com.example.xagent.model.DocumentInput;
import com.example.xagent.model.DomainHandlerDescriptor;
import com.example.xagent.model.PipelineResult;
import com.example.xagent.model.PipelineStatus;
import com.example.xagent.model.PipelineTimings;
import com.example.xagent.orchestrator.PipelineOrchestrator;
import com.example.xagent.service.HandlerCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST entry point of the refinement pipeline.
 */
@RestController
@RequestMapping("/api")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineOrchestrator orchestrator;
    private final HandlerCatalog catalog;

    public PipelineController(PipelineOrchestrator orchestrator, HandlerCatalog catalog) {
        this.orchestrator = orchestrator;
        this.catalog = catalog;
    }

    /**
     * Runs a document through resolution and refinement.
     *
     * <p>Endpoint: POST /api/pipeline
     * <p>Body: {@code {"content": "...", "domainHint": "..."}}
     * <p>200 with an APPROVED or REJECTED result, 400 with an ERROR result for malformed input.
     */
    @PostMapping(value = "/pipeline", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> run(@RequestBody(required = false) DocumentInput input) {
        int length = input != null && input.content() != null ? input.content().length() : 0;
        log.info("Received pipeline request ({} characters, hint '{}')",
                length, input != null ? input.domainHint() : null);
        try {
            PipelineResult result = orchestrator.run(input);
            if (result.status() == PipelineStatus.ERROR) {
                return ResponseEntity.badRequest().body(result);
            }
            return ResponseEntity.ok()
                    .headers(responseHeaders(result.timings()))
                    .body(result);

        } catch (Exception e) {
            log.error("Error during pipeline run", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during pipeline run",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Lists known domains, built-in and synthesized, in registration order.
     *
     * <p>Endpoint: GET /api/domains
     */
    @GetMapping("/domains")
    public List<DomainHandlerDescriptor> domains() {
        return catalog.descriptors();
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        List<DomainHandlerDescriptor> descriptors = catalog.descriptors();
        long custom = descriptors.stream().filter(DomainHandlerDescriptor::customCreated).count();
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "X-Agent-Pipeline",
                "domains", descriptors.size(),
                "customDomains", custom
        ));
    }

    private HttpHeaders responseHeaders(PipelineTimings timings) {
        HttpHeaders h = new HttpHeaders();
        if (timings != null) {
            h.set("X-Pipeline-Stage-Resolution-Seconds", String.valueOf(timings.resolutionSeconds()));
            h.set("X-Pipeline-Stage-Refinement-Seconds", String.valueOf(timings.refinementSeconds()));
            h.set("X-Pipeline-Total-Seconds", String.valueOf(timings.totalSeconds()));
        }
        return h;
    }
}

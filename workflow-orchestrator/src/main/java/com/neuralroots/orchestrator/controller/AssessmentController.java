package com.neuralroots.orchestrator.controller;

import com.neuralroots.analysis.validation.ValidationReport;
import com.neuralroots.common.model.ShipmentRequest;
import com.neuralroots.common.model.WorkflowRecord;
import com.neuralroots.orchestrator.dto.HealthReport;
import com.neuralroots.orchestrator.dto.QuickAssessment;
import com.neuralroots.orchestrator.service.OrchestratorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/workflow")
public class AssessmentController {

    private final OrchestratorService orchestratorService;

    public AssessmentController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/assess")
    public Mono<ResponseEntity<WorkflowRecord>> assess(@RequestBody ShipmentRequest request) {
        return orchestratorService.assess(request).map(ResponseEntity::ok);
    }

    @PostMapping("/quick-assessment")
    public Mono<ResponseEntity<QuickAssessment>> quickAssessment(@RequestBody ShipmentRequest request) {
        return orchestratorService.quickAssess(request).map(ResponseEntity::ok);
    }

    @PostMapping("/validate-input")
    public ResponseEntity<ValidationReport> validateInput(@RequestBody ShipmentRequest request) {
        return ResponseEntity.ok(orchestratorService.validate(request));
    }

    @GetMapping("/history")
    public ResponseEntity<List<WorkflowRecord>> history(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(orchestratorService.getHistory(limit));
    }

    @GetMapping("/history/{workflowId}")
    public ResponseEntity<WorkflowRecord> workflow(@PathVariable String workflowId) {
        return ResponseEntity.ok(orchestratorService.getWorkflow(workflowId));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        return ResponseEntity.ok(orchestratorService.getHealth());
    }
}

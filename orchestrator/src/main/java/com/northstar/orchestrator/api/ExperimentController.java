package com.northstar.orchestrator.api;

import com.northstar.orchestrator.api.dto.ExecuteRequest;
import com.northstar.orchestrator.api.dto.ExperimentResponse;
import com.northstar.orchestrator.service.ExecutionResult;
import com.northstar.orchestrator.service.ExecutionService;
import com.northstar.orchestrator.service.ExperimentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for experiments.
 *
 * POST /experiments                  ad-hoc execution, no proposal involved
 * GET  /experiments/{id}             one experiment
 * GET  /experiments?proposalId=...   all attempts for a proposal
 */
@RestController
@RequestMapping("/experiments")
public class ExperimentController {

    private final ExecutionService  executionService;
    private final ExperimentService experimentService;

    public ExperimentController(ExecutionService executionService, ExperimentService experimentService) {
        this.executionService  = executionService;
        this.experimentService = experimentService;
    }

    @PostMapping
    public ResponseEntity<ExperimentResponse> execute(@RequestBody ExecuteRequest req) {
        ExecutionResult result = executionService.execute(req.toExecutionRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(get(result.experimentId()));
    }

    @GetMapping("/{id}")
    public ExperimentResponse get(@PathVariable UUID id) {
        return experimentService.findById(id)
                .map(ExperimentResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Experiment not found: " + id));
    }

    @GetMapping
    public List<ExperimentResponse> listByProposal(@RequestParam String proposalId) {
        return experimentService.listByProposal(proposalId).stream()
                .map(ExperimentResponse::from)
                .toList();
    }
}

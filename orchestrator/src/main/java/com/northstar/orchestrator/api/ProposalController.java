package com.northstar.orchestrator.api;

import com.northstar.orchestrator.api.dto.ApproveProposalRequest;
import com.northstar.orchestrator.api.dto.CreateProposalRequest;
import com.northstar.orchestrator.api.dto.ExperimentResponse;
import com.northstar.orchestrator.api.dto.ProposalResponse;
import com.northstar.orchestrator.model.ProposalStatus;
import com.northstar.orchestrator.service.ApprovalOverrides;
import com.northstar.orchestrator.service.ProposalService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for proposals.
 *
 * POST /proposals                 extract a proposal from raw model output
 * GET  /proposals/{id}            one proposal
 * GET  /proposals?status=&repo=   list, newest first
 * POST /proposals/{id}/approve    approve and execute; returns the experiment
 * POST /proposals/{id}/reject     reject
 */
@RestController
@RequestMapping("/proposals")
public class ProposalController {

    private final ProposalService proposalService;

    public ProposalController(ProposalService proposalService) {
        this.proposalService = proposalService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/proposals \
     *     -H "Content-Type: application/json" \
     *     -d '{"rawText":"{\"idea_summary\":\"...\"}","repoFullname":"acme/shop"}'
     */
    @PostMapping
    public ResponseEntity<ProposalResponse> create(@RequestBody CreateProposalRequest req) {
        var proposal = proposalService.createFromModelOutput(req.rawText(), req.repoFullname(), req.oauthSessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalResponse.from(proposal));
    }

    @GetMapping("/{id}")
    public ProposalResponse get(@PathVariable String id) {
        return proposalService.findById(id)
                .map(ProposalResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Proposal not found: " + id));
    }

    @GetMapping
    public List<ProposalResponse> list(@RequestParam(required = false) ProposalStatus status,
                                       @RequestParam(name = "repo", required = false) String repoFullname) {
        return proposalService.list(status, repoFullname).stream()
                .map(ProposalResponse::from)
                .toList();
    }

    /**
     * Approve and execute synchronously. A failed execution still returns 200
     * with the FAILED experiment; the failure kind is in failureReason.
     */
    @PostMapping("/{id}/approve")
    public ExperimentResponse approve(@PathVariable String id,
                                      @RequestBody(required = false) ApproveProposalRequest req) {
        ApprovalOverrides overrides = req == null ? ApprovalOverrides.none() : req.toOverrides();
        return ExperimentResponse.from(proposalService.approve(id, overrides));
    }

    @PostMapping("/{id}/reject")
    public ProposalResponse reject(@PathVariable String id) {
        return ProposalResponse.from(proposalService.reject(id));
    }
}

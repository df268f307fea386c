package com.northstar.orchestrator.service;

import com.northstar.orchestrator.extract.ProposalExtractor;
import com.northstar.orchestrator.extract.ProposalFields;
import com.northstar.orchestrator.model.ConnectedRepo;
import com.northstar.orchestrator.model.ExpectedImpact;
import com.northstar.orchestrator.model.Experiment;
import com.northstar.orchestrator.model.PlanItem;
import com.northstar.orchestrator.model.Proposal;
import com.northstar.orchestrator.model.ProposalStatus;
import com.northstar.orchestrator.repository.ConnectedRepoRepository;
import com.northstar.orchestrator.repository.ExperimentRepository;
import com.northstar.orchestrator.repository.ProposalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Proposal lifecycle: creation from model output, review decisions, and
 * hand-off to {@link ExecutionService} on approval.
 *
 * approve() is not @Transactional: an execution takes minutes and each
 * status change is saved on its own so it is visible while it runs. A
 * concurrent second approval fails on the Proposal @Version column.
 */
@Service
public class ProposalService {

    private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

    private static final String DEFAULT_BASE_BRANCH = "main";

    private final ProposalRepository      proposalRepo;
    private final ExperimentRepository    experimentRepo;
    private final ConnectedRepoRepository connectedRepoRepo;
    private final ProposalExtractor       extractor;
    private final ExecutionService        executionService;

    public ProposalService(ProposalRepository proposalRepo,
                           ExperimentRepository experimentRepo,
                           ConnectedRepoRepository connectedRepoRepo,
                           ProposalExtractor extractor,
                           ExecutionService executionService) {
        this.proposalRepo      = proposalRepo;
        this.experimentRepo    = experimentRepo;
        this.connectedRepoRepo = connectedRepoRepo;
        this.extractor         = extractor;
        this.executionService  = executionService;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Extract a proposal from raw model output and store it as PENDING.
     *
     * @throws com.northstar.orchestrator.extract.ExtractionException if no proposal can be recovered
     */
    @Transactional
    public Proposal createFromModelOutput(String rawText, String repoFullname, String oauthSessionId) {
        if (repoFullname == null || repoFullname.isBlank()) {
            throw new IllegalArgumentException("repoFullname is required");
        }
        ProposalFields fields = extractor.extract(rawText);

        Proposal proposal = new Proposal(Proposal.newId(repoFullname, Instant.now()), repoFullname);
        proposal.setExternalRef(fields.proposalId());
        proposal.setIdeaSummary(fields.ideaSummary());
        proposal.setRationale(fields.rationale());
        proposal.setCategory(fields.category());
        if (fields.expectedImpact() != null) {
            proposal.setExpectedImpact(new ExpectedImpact(
                    fields.expectedImpact().metric(), fields.expectedImpact().deltaPct()));
        }
        proposal.setTechnicalPlan(fields.technicalPlan().stream()
                .map(step -> new PlanItem(step.file(), step.action()))
                .toList());
        proposal.setUpdateBlock(fields.updateBlock());
        proposal.setConfidence(fields.confidence());
        proposal.setOauthSessionId(oauthSessionId);

        Proposal saved = proposalRepo.save(proposal);
        log.info("Proposal {} created for {} ({} plan steps, confidence {})",
                saved.getId(), repoFullname, saved.getTechnicalPlan().size(), saved.getConfidence());
        return saved;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Proposal> findById(String id) {
        return proposalRepo.findById(id);
    }

    /** Newest first. Both filters are optional. */
    @Transactional(readOnly = true)
    public List<Proposal> list(ProposalStatus status, String repoFullname) {
        boolean byRepo = repoFullname != null && !repoFullname.isBlank();
        if (status != null && byRepo) {
            return proposalRepo.findByRepoFullnameAndStatusOrderByCreatedAtDesc(repoFullname, status);
        }
        if (status != null) return proposalRepo.findByStatusOrderByCreatedAtDesc(status);
        if (byRepo)         return proposalRepo.findByRepoFullnameOrderByCreatedAtDesc(repoFullname);
        return proposalRepo.findAllByOrderByCreatedAtDesc();
    }

    // ------------------------------------------------------------------
    // Decisions
    // ------------------------------------------------------------------

    @Transactional
    public Proposal reject(String id) {
        Proposal proposal = require(id);
        proposal.transitionTo(ProposalStatus.REJECTED);
        log.info("Proposal {} rejected", id);
        return proposalRepo.save(proposal);
    }

    /**
     * Approve a PENDING proposal and execute it.
     *
     * Instruction defaults to the idea summary, the update block to the
     * proposal's own, the file to the first technical-plan entry. The base
     * branch comes from the connected repository, "main" if there is none.
     *
     * @return the Experiment, COMPLETED or FAILED
     * @throws ExecutionFailedException only when no Experiment could be created
     *         (invalid request); the proposal is FAILED in that case too
     */
    public Experiment approve(String id, ApprovalOverrides overrides) {
        ApprovalOverrides edits = overrides == null ? ApprovalOverrides.none() : overrides;

        Proposal proposal = require(id);
        proposal.transitionTo(ProposalStatus.APPROVED);
        proposal = proposalRepo.save(proposal);

        String instruction = firstNonBlank(edits.instruction(), proposal.getIdeaSummary());
        String updateBlock = edits.updateBlock() != null ? edits.updateBlock() : proposal.getUpdateBlock();
        String filePath    = firstNonBlank(edits.filePath(), proposal.targetFile());
        String baseBranch  = connectedRepoRepo.findById(proposal.getRepoFullname())
                .map(ConnectedRepo::getBaseBranch)
                .orElse(DEFAULT_BASE_BRANCH);

        proposal.transitionTo(ProposalStatus.EXECUTING);
        proposal = proposalRepo.save(proposal);
        if (filePath == null || filePath.isBlank()) {
            proposal.transitionTo(ProposalStatus.FAILED);
            proposalRepo.save(proposal);
            throw new ExecutionFailedException(ExecutionFailedException.Kind.INVALID_REQUEST,
                    "Proposal " + id + " names no target file; pass filePath when approving",
                    proposal.getRepoFullname(), null, instruction, null);
        }
        log.info("Proposal {} approved, executing against {}:{}", id, proposal.getRepoFullname(), filePath);

        try {
            ExecutionResult result = executionService.execute(new ExecutionRequest(
                    proposal.getId(), instruction, updateBlock, proposal.getRepoFullname(), filePath, baseBranch));
            proposal.transitionTo(ProposalStatus.COMPLETED);
            proposalRepo.save(proposal);
            return experimentRepo.findById(result.experimentId())
                    .orElseThrow(() -> new NotFoundException("Experiment", result.experimentId()));
        } catch (ExecutionFailedException e) {
            proposal.transitionTo(ProposalStatus.FAILED);
            proposalRepo.save(proposal);
            log.warn("Proposal {} FAILED: {}", id, e.getMessage());
            if (e.getExperimentId() == null) throw e;
            return experimentRepo.findById(e.getExperimentId()).orElseThrow(() -> e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Proposal require(String id) {
        return proposalRepo.findById(id).orElseThrow(() -> new NotFoundException("Proposal", id));
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}

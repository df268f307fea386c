package com.northstar.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.northstar.orchestrator.extract.ExtractionException;
import com.northstar.orchestrator.extract.ProposalExtractor;
import com.northstar.orchestrator.model.*;
import com.northstar.orchestrator.repository.ConnectedRepoRepository;
import com.northstar.orchestrator.repository.ExperimentRepository;
import com.northstar.orchestrator.repository.ProposalRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProposalService. Repositories and ExecutionService are
 * mocked; the extractor is the real one.
 */
@ExtendWith(MockitoExtension.class)
class ProposalServiceTest {

    private static final String REPO = "acme/shop";

    @Mock ProposalRepository      proposalRepo;
    @Mock ExperimentRepository    experimentRepo;
    @Mock ConnectedRepoRepository connectedRepoRepo;
    @Mock ExecutionService        executionService;

    ProposalService service;

    @BeforeEach
    void setUp() {
        service = new ProposalService(proposalRepo, experimentRepo, connectedRepoRepo,
                new ProposalExtractor(new ObjectMapper()), executionService);
        lenient().when(proposalRepo.save(any(Proposal.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // ------------------------------------------------------------------
    // createFromModelOutput()
    // ------------------------------------------------------------------

    @Test
    void create_validOutput_persistsPendingProposalWithFreshId() {
        String raw = "Here you go:\n{\"proposal_id\":\"p-7\",\"idea_summary\":\"Increase button contrast\","
                + "\"technical_plan\":[{\"file\":\"src/Button.tsx\",\"action\":\"darken\"}],"
                + "\"update_block\":\"const bg = '#111';\",\"confidence\":0.9}";

        Proposal p = service.createFromModelOutput(raw, REPO, "oauth-1");

        assertThat(p.getId()).matches("prop-\\d+-[0-9a-f]{8}-[0-9a-f]{4}");
        assertThat(p.getExternalRef()).isEqualTo("p-7");
        assertThat(p.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(p.getRepoFullname()).isEqualTo(REPO);
        assertThat(p.getOauthSessionId()).isEqualTo("oauth-1");
        assertThat(p.targetFile()).isEqualTo("src/Button.tsx");
        assertThat(p.getUpdateBlock()).isEqualTo("const bg = '#111';");
        assertThat(p.getConfidence()).isEqualTo(0.9);
        verify(proposalRepo).save(p);
    }

    @Test
    void create_refusal_throwsAndPersistsNothing() {
        assertThatThrownBy(() -> service.createFromModelOutput("I'm sorry, I can't help with that.", REPO, null))
                .isInstanceOf(ExtractionException.class);
        verify(proposalRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // approve()
    // ------------------------------------------------------------------

    @Test
    void approve_defaults_executeWithSummaryFirstPlanFileAndRepoBaseBranch() {
        Proposal proposal = pendingProposal();
        when(proposalRepo.findById(proposal.getId())).thenReturn(Optional.of(proposal));
        ConnectedRepo repo = new ConnectedRepo(REPO, "user-1");
        repo.setBaseBranch("develop");
        when(connectedRepoRepo.findById(REPO)).thenReturn(Optional.of(repo));
        UUID experimentId = UUID.randomUUID();
        when(executionService.execute(any())).thenReturn(new ExecutionResult(
                experimentId, "https://github.com/acme/shop/pull/1", "northstar/increase-button-contrast",
                List.of("src/Button.tsx"), "2 lines changed"));
        Experiment experiment = new Experiment(proposal.getId(), "Increase button contrast", "u", REPO, "src/Button.tsx", "develop");
        when(experimentRepo.findById(experimentId)).thenReturn(Optional.of(experiment));

        Experiment result = service.approve(proposal.getId(), ApprovalOverrides.none());

        assertThat(result).isSameAs(experiment);
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.COMPLETED);
        ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executionService).execute(captor.capture());
        ExecutionRequest req = captor.getValue();
        assertThat(req.proposalId()).isEqualTo(proposal.getId());
        assertThat(req.instruction()).isEqualTo("Increase button contrast");
        assertThat(req.updateBlock()).isEqualTo("const bg = '#111';");
        assertThat(req.filePath()).isEqualTo("src/Button.tsx");
        assertThat(req.baseBranch()).isEqualTo("develop");
    }

    @Test
    void approve_overrides_replaceProposalValuesAndBaseDefaultsToMain() {
        Proposal proposal = pendingProposal();
        when(proposalRepo.findById(proposal.getId())).thenReturn(Optional.of(proposal));
        when(connectedRepoRepo.findById(REPO)).thenReturn(Optional.empty());
        UUID experimentId = UUID.randomUUID();
        when(executionService.execute(any())).thenReturn(new ExecutionResult(
                experimentId, "https://github.com/acme/shop/pull/2", "northstar/x", List.of("src/Other.tsx"), "1 lines changed"));
        when(experimentRepo.findById(experimentId)).thenReturn(Optional.of(
                new Experiment(proposal.getId(), "x", "y", REPO, "src/Other.tsx", "main")));

        service.approve(proposal.getId(), new ApprovalOverrides("Use a darker shade", "const bg = '#000';", "src/Other.tsx"));

        ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executionService).execute(captor.capture());
        assertThat(captor.getValue().instruction()).isEqualTo("Use a darker shade");
        assertThat(captor.getValue().updateBlock()).isEqualTo("const bg = '#000';");
        assertThat(captor.getValue().filePath()).isEqualTo("src/Other.tsx");
        assertThat(captor.getValue().baseBranch()).isEqualTo("main");
        assertThat(proposal.getUpdateBlock()).isEqualTo("const bg = '#111';");
    }

    @Test
    void approve_executionFails_returnsFailedExperimentAndFailsProposal() {
        Proposal proposal = pendingProposal();
        when(proposalRepo.findById(proposal.getId())).thenReturn(Optional.of(proposal));
        UUID experimentId = UUID.randomUUID();
        ExecutionFailedException failure = new ExecutionFailedException(ExecutionFailedException.Kind.NO_CHANGE_DETECTED,
                "Merged code is identical to the original", REPO, null, "Increase button contrast", null);
        failure.setExperimentId(experimentId);
        when(executionService.execute(any())).thenThrow(failure);
        Experiment failed = new Experiment(proposal.getId(), "i", "u", REPO, "src/Button.tsx", "main");
        failed.fail("NO_CHANGE_DETECTED", failure.getMessage());
        when(experimentRepo.findById(experimentId)).thenReturn(Optional.of(failed));

        Experiment result = service.approve(proposal.getId(), null);

        assertThat(result.getStatus()).isEqualTo(ExperimentStatus.FAILED);
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.FAILED);
    }

    @Test
    void approve_noTargetFile_failsProposalWithInvalidRequest() {
        Proposal proposal = new Proposal("prop-2", REPO);
        proposal.setIdeaSummary("Rewrite copy");
        when(proposalRepo.findById("prop-2")).thenReturn(Optional.of(proposal));

        assertThatThrownBy(() -> service.approve("prop-2", ApprovalOverrides.none()))
                .isInstanceOf(ExecutionFailedException.class)
                .satisfies(e -> assertThat(((ExecutionFailedException) e).getKind())
                        .isEqualTo(ExecutionFailedException.Kind.INVALID_REQUEST));
        assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.FAILED);
        verifyNoInteractions(executionService);
    }

    @Test
    void approve_rejectedProposal_isIllegalTransition() {
        Proposal proposal = pendingProposal();
        proposal.transitionTo(ProposalStatus.REJECTED);
        when(proposalRepo.findById(proposal.getId())).thenReturn(Optional.of(proposal));

        assertThatThrownBy(() -> service.approve(proposal.getId(), null))
                .isInstanceOf(IllegalStateTransitionException.class)
                .hasMessageContaining("REJECTED");
        verifyNoInteractions(executionService);
    }

    @Test
    void approve_unknownId_isNotFound() {
        when(proposalRepo.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.approve("nope", null)).isInstanceOf(NotFoundException.class);
    }

    // ------------------------------------------------------------------
    // reject() / list()
    // ------------------------------------------------------------------

    @Test
    void reject_pending_becomesRejectedAndFrozen() {
        Proposal proposal = pendingProposal();
        when(proposalRepo.findById(proposal.getId())).thenReturn(Optional.of(proposal));

        assertThat(service.reject(proposal.getId()).getStatus()).isEqualTo(ProposalStatus.REJECTED);
        assertThatThrownBy(() -> proposal.setUpdateBlock("changed")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void list_filtersPickMatchingQuery() {
        service.list(ProposalStatus.PENDING, REPO);
        service.list(ProposalStatus.PENDING, null);
        service.list(null, REPO);
        service.list(null, " ");

        verify(proposalRepo).findByRepoFullnameAndStatusOrderByCreatedAtDesc(REPO, ProposalStatus.PENDING);
        verify(proposalRepo).findByStatusOrderByCreatedAtDesc(ProposalStatus.PENDING);
        verify(proposalRepo).findByRepoFullnameOrderByCreatedAtDesc(REPO);
        verify(proposalRepo).findAllByOrderByCreatedAtDesc();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Proposal pendingProposal() {
        Proposal p = new Proposal("prop-1700000000000-0a1b2c3d-beef", REPO);
        p.setIdeaSummary("Increase button contrast");
        p.setTechnicalPlan(List.of(new PlanItem("src/Button.tsx", "darken background")));
        p.setUpdateBlock("const bg = '#111';");
        return p;
    }
}

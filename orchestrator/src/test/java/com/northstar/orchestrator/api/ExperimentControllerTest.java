package com.northstar.orchestrator.api;

import com.northstar.orchestrator.model.Experiment;
import com.northstar.orchestrator.service.ExecutionFailedException;
import com.northstar.orchestrator.service.ExecutionResult;
import com.northstar.orchestrator.service.ExecutionService;
import com.northstar.orchestrator.service.ExperimentService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ExperimentController.class)
class ExperimentControllerTest {

    @Autowired MockMvc             mockMvc;
    @MockitoBean ExecutionService  executionService;
    @MockitoBean ExperimentService experimentService;

    @Test
    void execute_success_returns201WithCompletedExperiment() throws Exception {
        Experiment experiment = experiment();
        experiment.complete("https://github.com/acme/shop/pull/9", "northstar/fix-label", "4 lines changed");
        when(executionService.execute(any())).thenReturn(new ExecutionResult(
                experiment.getId(), experiment.getPrUrl(), experiment.getBranch(), List.of("src/a.ts"), "4 lines changed"));
        when(experimentService.findById(experiment.getId())).thenReturn(Optional.of(experiment));

        mockMvc.perform(post("/experiments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"instruction":"fix label","updateBlock":"x","repoFullname":"acme/shop","filePath":"src/a.ts"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.prUrl").value("https://github.com/acme/shop/pull/9"));
    }

    @Test
    void execute_unauthorized_returns502WithKindAndExperimentId() throws Exception {
        UUID experimentId = UUID.randomUUID();
        ExecutionFailedException failure = new ExecutionFailedException(ExecutionFailedException.Kind.UNAUTHORIZED,
                "GitHub API error (HTTP 401): Bad credentials", "acme/shop", "northstar/fix-label", "fix label", null);
        ReflectionTestUtils.setField(failure, "experimentId", experimentId);
        when(executionService.execute(any())).thenThrow(failure);

        mockMvc.perform(post("/experiments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"instruction":"fix label","updateBlock":"x","repoFullname":"acme/shop","filePath":"src/a.ts"}
                                """))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.experimentId").value(experimentId.toString()))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void get_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(experimentService.findById(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/experiments/{id}", id)).andExpect(status().isNotFound());
    }

    @Test
    void listByProposal_returnsAttempts() throws Exception {
        when(experimentService.listByProposal("prop-1")).thenReturn(List.of(experiment()));

        mockMvc.perform(get("/experiments").param("proposalId", "prop-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].proposalId").value("prop-1"))
                .andExpect(jsonPath("$[0].status").value("RUNNING"));
    }

    private static Experiment experiment() {
        Experiment e = new Experiment("prop-1", "fix label", "x", "acme/shop", "src/a.ts", "main");
        ReflectionTestUtils.setField(e, "id", UUID.randomUUID());
        return e;
    }
}

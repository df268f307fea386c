package com.northstar.orchestrator.service;

import com.northstar.orchestrator.model.Experiment;
import com.northstar.orchestrator.repository.ExperimentRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Read side of experiments. Writes go through ExecutionService. */
@Service
@Transactional(readOnly = true)
public class ExperimentService {

    private final ExperimentRepository experimentRepo;

    public ExperimentService(ExperimentRepository experimentRepo) {
        this.experimentRepo = experimentRepo;
    }

    public Optional<Experiment> findById(UUID id) {
        return experimentRepo.findById(id);
    }

    /** Oldest first, so retries of one proposal read in order. */
    public List<Experiment> listByProposal(String proposalId) {
        return experimentRepo.findByProposalIdOrderByCreatedAtAsc(proposalId);
    }
}

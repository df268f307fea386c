package com.northstar.orchestrator.repository;

import com.northstar.orchestrator.model.Experiment;
import com.northstar.orchestrator.model.ExperimentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** CRUD + query operations for the experiments table. */
public interface ExperimentRepository extends JpaRepository<Experiment, UUID> {

    List<Experiment> findByProposalIdOrderByCreatedAtAsc(String proposalId);

    /** Used by StaleExperimentSweeper to find executions whose worker died. */
    List<Experiment> findByStatusAndCreatedAtBefore(ExperimentStatus status, Instant cutoff);

    /**
     * Record the allocated branch while the pipeline is still running.
     * Written from the worker thread, so it bypasses the caller's entity instance.
     */
    @Transactional
    @Modifying
    @Query("UPDATE Experiment e SET e.branch = :branch WHERE e.id = :id")
    int recordBranch(@Param("id") UUID id, @Param("branch") String branch);
}

package com.northstar.orchestrator.repository;

import com.northstar.orchestrator.model.Proposal;
import com.northstar.orchestrator.model.ProposalStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD + query operations for the proposals table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface ProposalRepository extends JpaRepository<Proposal, String> {

    List<Proposal> findByStatusOrderByCreatedAtDesc(ProposalStatus status);

    List<Proposal> findByRepoFullnameOrderByCreatedAtDesc(String repoFullname);

    List<Proposal> findByRepoFullnameAndStatusOrderByCreatedAtDesc(String repoFullname, ProposalStatus status);

    List<Proposal> findAllByOrderByCreatedAtDesc();
}

package com.northstar.orchestrator.repository;

import com.northstar.orchestrator.model.ConnectedRepo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/** CRUD for the repositories table. */
public interface ConnectedRepoRepository extends JpaRepository<ConnectedRepo, String> {

    List<ConnectedRepo> findByUserIdOrderByCreatedAtAsc(String userId);

    Optional<ConnectedRepo> findFirstByUserIdAndActiveTrue(String userId);

    /**
     * Clear the active flag on every repository of a user except one.
     * Must run inside the same transaction that activates {@code keep}.
     */
    @Modifying
    @Query("""
            UPDATE ConnectedRepo r SET r.active = false
            WHERE r.userId = :userId AND r.repoFullname <> :keep
            """)
    int deactivateOthers(@Param("userId") String userId, @Param("keep") String keep);
}

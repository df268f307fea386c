package com.northstar.orchestrator.service;

import com.northstar.orchestrator.model.ConnectedRepo;
import com.northstar.orchestrator.repository.ConnectedRepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Connected repositories. Each user has at most one active repository; the
 * first one connected becomes active automatically.
 */
@Service
public class RepositoryService {

    private static final Logger log = LoggerFactory.getLogger(RepositoryService.class);

    private static final Pattern FULLNAME = Pattern.compile("[A-Za-z0-9_.-]+/[A-Za-z0-9_.-]+");

    private final ConnectedRepoRepository repoRepo;

    public RepositoryService(ConnectedRepoRepository repoRepo) {
        this.repoRepo = repoRepo;
    }

    /** Connect a repository, or update the branches of an already connected one. */
    @Transactional
    public ConnectedRepo connect(String repoFullname, String defaultBranch, String baseBranch, String userId) {
        if (repoFullname == null || !FULLNAME.matcher(repoFullname).matches()) {
            throw new IllegalArgumentException("repoFullname must look like owner/name, got '" + repoFullname + "'");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }

        ConnectedRepo repo = repoRepo.findById(repoFullname)
                .orElseGet(() -> new ConnectedRepo(repoFullname, userId));
        if (!repo.getUserId().equals(userId)) {
            throw new IllegalArgumentException(repoFullname + " is already connected by another user");
        }
        if (defaultBranch != null && !defaultBranch.isBlank()) repo.setDefaultBranch(defaultBranch);
        if (baseBranch != null && !baseBranch.isBlank()) {
            repo.setBaseBranch(baseBranch);
        } else if (defaultBranch != null && !defaultBranch.isBlank()) {
            repo.setBaseBranch(defaultBranch);
        }
        if (repoRepo.findFirstByUserIdAndActiveTrue(userId).isEmpty()) {
            repo.setActive(true);
        }

        ConnectedRepo saved = repoRepo.save(repo);
        log.info("Repository {} connected for user {} (base {}, active={})",
                repoFullname, userId, saved.getBaseBranch(), saved.isActive());
        return saved;
    }

    /** Make one repository the user's active one, deactivating the rest. */
    @Transactional
    public ConnectedRepo activate(String repoFullname) {
        ConnectedRepo repo = repoRepo.findById(repoFullname)
                .orElseThrow(() -> new NotFoundException("Repository", repoFullname));
        int cleared = repoRepo.deactivateOthers(repo.getUserId(), repoFullname);
        repo.setActive(true);
        log.info("Repository {} activated for user {} ({} deactivated)", repoFullname, repo.getUserId(), cleared);
        return repoRepo.save(repo);
    }

    @Transactional(readOnly = true)
    public Optional<ConnectedRepo> findActive(String userId) {
        return repoRepo.findFirstByUserIdAndActiveTrue(userId);
    }

    @Transactional(readOnly = true)
    public List<ConnectedRepo> list(String userId) {
        return repoRepo.findByUserIdOrderByCreatedAtAsc(userId);
    }
}

package com.northstar.orchestrator.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Produces a checked-out branch whose name is not taken yet.
 *
 * Probing is linear: name, name-v2, name-v3, ... up to {@link #MAX_PROBES}
 * candidates. A name counts as taken if it exists as a local branch or as a
 * remote-tracking branch of origin. Nothing here is locked; two executions
 * racing for the same name surface later as a rejected push, which is handled
 * by {@link #reallocate}.
 */
@Component
public class BranchAllocator {

    private static final Logger log = LoggerFactory.getLogger(BranchAllocator.class);

    static final int MAX_PROBES = 50;

    private static final String ORIGIN_PREFIX = Constants.R_REMOTES + "origin/";

    /**
     * Check out {@code baseBranch}, from origin if there is no local branch yet.
     * A no-op when it is already checked out, so a dirty tree survives it.
     *
     * @throws GitException BASE_BRANCH_MISSING or GIT_ERROR
     */
    public void checkoutBase(GitWorkspace workspace, String baseBranch) {
        checkoutBase(workspace.git(), baseBranch);
    }

    /**
     * Check out {@code baseBranch}, then create and check out the first free
     * name derived from {@code branchName}.
     *
     * @return the branch name actually created
     * @throws GitException BASE_BRANCH_MISSING, BRANCH_ALLOCATION_EXHAUSTED or GIT_ERROR
     */
    public String allocate(GitWorkspace workspace, String baseBranch, String branchName) {
        Git git = workspace.git();
        checkoutBase(git, baseBranch);

        String chosen = firstFreeName(git.getRepository(), branchName);
        try {
            git.checkout().setCreateBranch(true).setName(chosen).call();
        } catch (Exception e) {
            throw new GitException(GitException.Kind.GIT_ERROR,
                    "Failed to create branch '" + chosen + "' from '" + baseBranch + "'", e);
        }
        log.info("Allocated branch '{}' from '{}' in {}", chosen, baseBranch, workspace.repoFullname());
        return chosen;
    }

    /**
     * Recover from a push race: fetch origin, find the next free name and rename
     * the current branch (with its commit) to it.
     *
     * @return the new branch name
     */
    public String reallocate(GitWorkspace workspace, String currentBranch, String branchName) {
        Git git = workspace.git();
        try {
            git.fetch()
                    .setRemote("origin")
                    .setCredentialsProvider(workspace.credentials())
                    .setTimeout(workspace.timeoutSeconds())
                    .call();
        } catch (Exception e) {
            throw new GitException(GitException.Kind.GIT_ERROR,
                    "Failed to fetch origin while re-probing branch name", e);
        }

        String chosen = firstFreeName(git.getRepository(), branchName);
        try {
            git.branchRename().setOldName(currentBranch).setNewName(chosen).call();
        } catch (Exception e) {
            throw new GitException(GitException.Kind.GIT_ERROR,
                    "Failed to rename branch '" + currentBranch + "' to '" + chosen + "'", e);
        }
        log.warn("Branch '{}' was taken on the remote, renamed to '{}'", currentBranch, chosen);
        return chosen;
    }

    private void checkoutBase(Git git, String baseBranch) {
        Repository repo = git.getRepository();
        try {
            if (baseBranch.equals(repo.getBranch())) {
                return;
            }
            if (repo.exactRef(Constants.R_HEADS + baseBranch) != null) {
                git.checkout().setName(baseBranch).call();
            } else if (repo.exactRef(ORIGIN_PREFIX + baseBranch) != null) {
                git.checkout()
                        .setCreateBranch(true)
                        .setName(baseBranch)
                        .setStartPoint("origin/" + baseBranch)
                        .call();
            } else {
                throw new GitException(GitException.Kind.BASE_BRANCH_MISSING,
                        "Base branch '" + baseBranch + "' does not exist. "
                        + "Verify the repository's base branch setting.");
            }
        } catch (GitException e) {
            throw e;
        } catch (Exception e) {
            throw new GitException(GitException.Kind.GIT_ERROR,
                    "Failed to check out base branch '" + baseBranch + "'", e);
        }
    }

    String firstFreeName(Repository repo, String branchName) {
        for (int attempt = 1; attempt <= MAX_PROBES; attempt++) {
            String candidate = attempt == 1 ? branchName : branchName + "-v" + attempt;
            if (!exists(repo, candidate)) {
                return candidate;
            }
        }
        throw new GitException(GitException.Kind.BRANCH_ALLOCATION_EXHAUSTED,
                "No free branch name for '" + branchName + "' after " + MAX_PROBES + " attempts");
    }

    private static boolean exists(Repository repo, String name) {
        try {
            return repo.exactRef(Constants.R_HEADS + name) != null
                || repo.exactRef(ORIGIN_PREFIX + name) != null;
        } catch (IOException e) {
            throw new GitException(GitException.Kind.GIT_ERROR, "Failed to read refs for '" + name + "'", e);
        }
    }
}

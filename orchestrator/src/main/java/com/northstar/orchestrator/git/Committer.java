package com.northstar.orchestrator.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Stages, commits and pushes a working tree, but only when there is something
 * to commit. A clean tree is reported as {@link Outcome#NO_CHANGE}; no empty
 * commit is ever created.
 */
@Component
public class Committer {

    private static final Logger log = LoggerFactory.getLogger(Committer.class);

    public enum Outcome { PUSHED, NO_CHANGE }

    private final String authorName;
    private final String authorEmail;

    public Committer(@Value("${northstar.git.author-name:Northstar}") String authorName,
                     @Value("${northstar.git.author-email:northstar@users.noreply.github.com}") String authorEmail) {
        this.authorName  = authorName;
        this.authorEmail = authorEmail;
    }

    /**
     * Stage everything (including deletions), commit and push {@code branch} to origin.
     *
     * @throws GitException PUSH_REJECTED if the remote refused the update, GIT_ERROR otherwise
     */
    public Outcome commitAndPush(GitWorkspace workspace, String branch, String message) {
        Git git = workspace.git();
        try {
            git.add().addFilepattern(".").call();
            git.add().addFilepattern(".").setUpdate(true).call();

            Status status = git.status().call();
            if (status.isClean()) {
                log.info("Working tree of {} is clean, nothing to commit", workspace.repoFullname());
                return Outcome.NO_CHANGE;
            }

            git.commit()
                    .setMessage(message)
                    .setAuthor(authorName, authorEmail)
                    .setCommitter(authorName, authorEmail)
                    .call();
        } catch (Exception e) {
            throw new GitException(GitException.Kind.GIT_ERROR,
                    "Failed to commit changes on '" + branch + "': " + e.getMessage(), e);
        }

        push(workspace, branch);
        return Outcome.PUSHED;
    }

    /** Push {@code branch} to the same name on origin. */
    public void push(GitWorkspace workspace, String branch) {
        Iterable<PushResult> results;
        try {
            log.info("Pushing branch '{}' to origin ({})", branch, workspace.repoFullname());
            results = workspace.git().push()
                    .setRemote("origin")
                    .setRefSpecs(new RefSpec("refs/heads/" + branch + ":refs/heads/" + branch))
                    .setCredentialsProvider(workspace.credentials())
                    .setTimeout(workspace.timeoutSeconds())
                    .call();
        } catch (Exception e) {
            throw new GitException(GitException.Kind.GIT_ERROR,
                    "Failed to push '" + branch + "': " + e.getMessage()
                    + ". Ensure the token has write access to the repository.", e);
        }

        for (PushResult result : results) {
            for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                switch (update.getStatus()) {
                    case OK, UP_TO_DATE -> log.debug("Push of {} -> {}", update.getRemoteName(), update.getStatus());
                    case REJECTED_NONFASTFORWARD, REJECTED_REMOTE_CHANGED ->
                            throw new GitException(GitException.Kind.PUSH_REJECTED,
                                    "Remote rejected '" + branch + "' (" + update.getStatus() + ")");
                    default -> throw new GitException(GitException.Kind.GIT_ERROR,
                            "Push of '" + branch + "' failed: " + update.getStatus()
                            + (update.getMessage() != null ? " " + update.getMessage() : ""));
                }
            }
        }
        log.info("Push of '{}' successful", branch);
    }
}

package com.northstar.orchestrator.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Clones a repository into an isolated temporary directory.
 *
 * Every execution gets its own clone, so concurrent executions never share
 * a working tree. The only shared state is the remote itself.
 */
@Component
public class GitWorkspaceFactory {

    private static final Logger log = LoggerFactory.getLogger(GitWorkspaceFactory.class);

    private final String   cloneUrlTemplate;
    private final String   token;
    private final Duration timeout;

    public GitWorkspaceFactory(@Value("${northstar.git.clone-url-template:https://github.com/%s.git}") String cloneUrlTemplate,
                               @Value("${northstar.github.token:}") String token,
                               @Value("${northstar.git.timeout:120s}") Duration timeout) {
        this.cloneUrlTemplate = cloneUrlTemplate;
        this.token            = token;
        this.timeout          = timeout;
    }

    /**
     * Clone {@code owner/name} with all remote branches.
     *
     * @throws GitException CLONE_FAILED; the temporary directory is already gone
     */
    public GitWorkspace cloneRepository(String repoFullname) {
        String url = cloneUrlTemplate.formatted(repoFullname);
        CredentialsProvider credentials = (token == null || token.isBlank())
                ? null
                : new UsernamePasswordCredentialsProvider("x-access-token", token);
        int timeoutSeconds = (int) timeout.toSeconds();

        Path directory;
        try {
            directory = Files.createTempDirectory("northstar_");
        } catch (IOException e) {
            throw new GitException(GitException.Kind.CLONE_FAILED,
                    "Could not create a temporary directory for " + repoFullname, e);
        }

        try {
            log.info("Cloning {} into {}", repoFullname, directory);
            Git git = Git.cloneRepository()
                    .setURI(url)
                    .setDirectory(directory.toFile())
                    .setCloneAllBranches(true)
                    .setCredentialsProvider(credentials)
                    .setTimeout(timeoutSeconds)
                    .call();
            return new GitWorkspace(repoFullname, git, directory, credentials, timeoutSeconds);
        } catch (Exception e) {
            deleteQuietly(directory);
            throw new GitException(GitException.Kind.CLONE_FAILED,
                    "Failed to clone repository '" + repoFullname + "': " + e.getMessage()
                    + ". Verify the repository exists and is accessible.", e);
        }
    }

    private static void deleteQuietly(Path directory) {
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            log.warn("Could not delete {} after failed clone: {}", directory, e.getMessage());
        }
    }
}

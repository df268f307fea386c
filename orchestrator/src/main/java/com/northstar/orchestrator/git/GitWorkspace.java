package com.northstar.orchestrator.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A fresh clone in its own temporary directory, owned by one execution.
 *
 * Use in try-with-resources: close() releases the repository and deletes the
 * directory whatever happened inside the block.
 */
public class GitWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GitWorkspace.class);

    private final String              repoFullname;
    private final Git                 git;
    private final Path                directory;
    private final CredentialsProvider credentials;
    private final int                 timeoutSeconds;

    GitWorkspace(String repoFullname, Git git, Path directory,
                 CredentialsProvider credentials, int timeoutSeconds) {
        this.repoFullname   = repoFullname;
        this.git            = git;
        this.directory      = directory;
        this.credentials    = credentials;
        this.timeoutSeconds = timeoutSeconds;
    }

    public String repoFullname() { return repoFullname; }
    public Git    git()          { return git; }
    public Path   directory()    { return directory; }

    /** Null for anonymous remotes (local paths, public read-only clones). */
    CredentialsProvider credentials() { return credentials; }
    int timeoutSeconds()              { return timeoutSeconds; }

    /**
     * Resolve a repository-relative path inside the working tree.
     *
     * @throws IllegalArgumentException if the path escapes the clone directory
     */
    public Path resolve(String relativePath) {
        Path resolved = directory.resolve(relativePath).normalize();
        if (!resolved.startsWith(directory)) {
            throw new IllegalArgumentException("Path escapes the repository: " + relativePath);
        }
        return resolved;
    }

    @Override
    public void close() {
        git.close();
        try {
            FileSystemUtils.deleteRecursively(directory);
            log.debug("Deleted workspace {} for {}", directory, repoFullname);
        } catch (IOException e) {
            log.warn("Could not delete workspace {} for {}; manual cleanup may be needed: {}",
                    directory, repoFullname, e.getMessage());
        }
    }
}

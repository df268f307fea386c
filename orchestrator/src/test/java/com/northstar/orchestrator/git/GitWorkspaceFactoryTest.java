package com.northstar.orchestrator.git;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitWorkspaceFactoryTest {

    @TempDir Path remotesDir;

    @Test
    void cloneRepository_existingRemote_checksOutMain() throws Exception {
        GitFixtures.createRemote(remotesDir, "acme/shop", Map.of("README.md", "# shop\n"));

        try (GitWorkspace ws = GitFixtures.factoryFor(remotesDir).cloneRepository("acme/shop")) {
            assertThat(ws.git().getRepository().getBranch()).isEqualTo("main");
            assertThat(Files.readString(ws.resolve("README.md"))).isEqualTo("# shop\n");
        }
    }

    @Test
    void close_deletesTheClone() throws Exception {
        GitFixtures.createRemote(remotesDir, "acme/shop", Map.of("README.md", "# shop\n"));

        GitWorkspace ws = GitFixtures.factoryFor(remotesDir).cloneRepository("acme/shop");
        Path dir = ws.directory();
        ws.close();

        assertThat(dir).doesNotExist();
    }

    @Test
    void cloneRepository_unknownRepo_isCloneFailed() {
        assertThatThrownBy(() -> GitFixtures.factoryFor(remotesDir).cloneRepository("acme/missing"))
                .isInstanceOf(GitException.class)
                .hasMessageContaining("acme/missing")
                .satisfies(e -> assertThat(((GitException) e).getKind()).isEqualTo(GitException.Kind.CLONE_FAILED));
    }

    @Test
    void resolve_pathOutsideClone_isRejected() throws Exception {
        GitFixtures.createRemote(remotesDir, "acme/shop", Map.of("README.md", "# shop\n"));

        try (GitWorkspace ws = GitFixtures.factoryFor(remotesDir).cloneRepository("acme/shop")) {
            assertThatThrownBy(() -> ws.resolve("../../etc/passwd"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

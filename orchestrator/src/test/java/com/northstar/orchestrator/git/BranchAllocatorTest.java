package com.northstar.orchestrator.git;

import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.lib.Repository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BranchAllocator against real JGit repositories: a local bare remote and a
 * fresh clone per test.
 */
class BranchAllocatorTest {

    private static final String REPO = "acme/shop";
    private static final String WANTED = "northstar/increase-button-contrast";

    @TempDir Path remotesDir;

    private Path                remote;
    private GitWorkspaceFactory factory;
    private final BranchAllocator allocator = new BranchAllocator();

    @BeforeEach
    void setUp() throws Exception {
        remote  = GitFixtures.createRemote(remotesDir, REPO, Map.of("src/Button.tsx", "const bg = '#eee';\n"));
        factory = GitFixtures.factoryFor(remotesDir);
    }

    @Test
    void allocate_freeName_createsAndChecksOutBranch() throws Exception {
        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            String branch = allocator.allocate(ws, "main", WANTED);

            assertThat(branch).isEqualTo(WANTED);
            assertThat(ws.git().getRepository().getBranch()).isEqualTo(WANTED);
        }
    }

    @Test
    void allocate_nameTakenOnRemote_appendsV2() throws Exception {
        GitFixtures.createRemoteBranch(remote, WANTED);

        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            assertThat(allocator.allocate(ws, "main", WANTED)).isEqualTo(WANTED + "-v2");
        }
    }

    @Test
    void allocate_nameAndV2Taken_appendsV3() throws Exception {
        GitFixtures.createRemoteBranch(remote, WANTED);
        GitFixtures.createRemoteBranch(remote, WANTED + "-v2");

        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            assertThat(allocator.allocate(ws, "main", WANTED)).isEqualTo(WANTED + "-v3");
        }
    }

    @Test
    void allocate_baseOnlyOnOrigin_checksOutTrackingBranch() throws Exception {
        GitFixtures.createRemoteBranch(remote, "develop");

        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            String branch = allocator.allocate(ws, "develop", WANTED);

            assertThat(branch).isEqualTo(WANTED);
            assertThat(ws.git().getRepository().exactRef(Constants.R_HEADS + "develop")).isNotNull();
        }
    }

    @Test
    void checkoutBase_branchDiffersFromDefault_checksOutItsContent() throws Exception {
        GitFixtures.pushBranch(remote, "develop", Map.of("src/Button.tsx", "const bg = '#222';\n"));

        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            allocator.checkoutBase(ws, "develop");

            assertThat(ws.git().getRepository().getBranch()).isEqualTo("develop");
            assertThat(Files.readString(ws.resolve("src/Button.tsx"))).isEqualTo("const bg = '#222';\n");
        }
    }

    @Test
    void allocate_onBaseWithEditedFile_keepsEdit() throws Exception {
        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            allocator.checkoutBase(ws, "main");
            Files.writeString(ws.resolve("src/Button.tsx"), "const bg = '#111';\n");

            allocator.allocate(ws, "main", WANTED);

            assertThat(Files.readString(ws.resolve("src/Button.tsx"))).isEqualTo("const bg = '#111';\n");
        }
    }

    @Test
    void allocate_missingBase_isBaseBranchMissing() {
        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            assertThatThrownBy(() -> allocator.allocate(ws, "release", WANTED))
                    .isInstanceOf(GitException.class)
                    .hasMessageContaining("release")
                    .satisfies(e -> assertThat(((GitException) e).getKind())
                            .isEqualTo(GitException.Kind.BASE_BRANCH_MISSING));
        }
    }

    @Test
    void firstFreeName_allCandidatesTaken_isExhausted() throws Exception {
        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            Repository repo = ws.git().getRepository();
            ObjectId main = repo.resolve(Constants.R_HEADS + "main");
            for (int i = 1; i <= BranchAllocator.MAX_PROBES; i++) {
                RefUpdate update = repo.updateRef(Constants.R_HEADS + (i == 1 ? "taken" : "taken-v" + i));
                update.setNewObjectId(main);
                update.update();
            }

            assertThatThrownBy(() -> allocator.firstFreeName(repo, "taken"))
                    .isInstanceOf(GitException.class)
                    .satisfies(e -> assertThat(((GitException) e).getKind())
                            .isEqualTo(GitException.Kind.BRANCH_ALLOCATION_EXHAUSTED));
        }
    }

    @Test
    void reallocate_afterRemoteRace_renamesToNextFreeName() throws Exception {
        try (GitWorkspace ws = factory.cloneRepository(REPO)) {
            String branch = allocator.allocate(ws, "main", WANTED);
            GitFixtures.pushCompetingBranch(remote, WANTED);

            String renamed = allocator.reallocate(ws, branch, WANTED);

            assertThat(renamed).isEqualTo(WANTED + "-v2");
            assertThat(ws.git().getRepository().getBranch()).isEqualTo(WANTED + "-v2");
        }
    }
}

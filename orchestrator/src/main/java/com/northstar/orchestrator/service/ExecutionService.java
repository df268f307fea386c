package com.northstar.orchestrator.service;

import com.northstar.orchestrator.git.BranchAllocator;
import com.northstar.orchestrator.git.Committer;
import com.northstar.orchestrator.git.GitException;
import com.northstar.orchestrator.git.GitWorkspace;
import com.northstar.orchestrator.git.GitWorkspaceFactory;
import com.northstar.orchestrator.git.Slugs;
import com.northstar.orchestrator.git.UnifiedDiff;
import com.northstar.orchestrator.github.PullRequestClient;
import com.northstar.orchestrator.github.PullRequestException;
import com.northstar.orchestrator.merge.MergeClient;
import com.northstar.orchestrator.merge.MergeException;
import com.northstar.orchestrator.model.Experiment;
import com.northstar.orchestrator.repository.ExperimentRepository;
import com.northstar.orchestrator.service.ExecutionFailedException.Kind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Turns an approved change into a pull request.
 *
 * Pipeline, strictly sequential:
 *   clone → check out base → read file → merge → (no-op check) → write file → diff
 *   → allocate branch → commit + push → open PR
 *
 * The Experiment row is saved as RUNNING before the pipeline starts and is
 * always left COMPLETED or FAILED when execute() returns or throws. The
 * pipeline runs on a fixed worker pool so the caller can enforce an overall
 * deadline; the clone is deleted by the worker on every exit path.
 *
 * The only retry is a single re-probe of the branch name when the push loses
 * a race with another writer.
 */
@Service
public class ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    static final int    MAX_DIFF_IN_BODY = 3000;
    static final String STAGE_TIMER      = "northstar.execution.stage";

    private final ExperimentRepository experimentRepo;
    private final GitWorkspaceFactory  workspaces;
    private final MergeClient          mergeClient;
    private final BranchAllocator      branchAllocator;
    private final Committer            committer;
    private final PullRequestClient    pullRequests;
    private final MeterRegistry        meterRegistry;
    private final Duration             deadline;
    private final String               branchPrefix;
    private final ExecutorService      workers;

    public ExecutionService(ExperimentRepository experimentRepo,
                            GitWorkspaceFactory workspaces,
                            MergeClient mergeClient,
                            BranchAllocator branchAllocator,
                            Committer committer,
                            PullRequestClient pullRequests,
                            MeterRegistry meterRegistry,
                            @Value("${northstar.execution.deadline:5m}") Duration deadline,
                            @Value("${northstar.execution.worker-count:4}") int workerCount,
                            @Value("${northstar.git.branch-prefix:northstar/}") String branchPrefix) {
        this.experimentRepo  = experimentRepo;
        this.workspaces      = workspaces;
        this.mergeClient     = mergeClient;
        this.branchAllocator = branchAllocator;
        this.committer       = committer;
        this.pullRequests    = pullRequests;
        this.meterRegistry   = meterRegistry;
        this.deadline        = deadline;
        this.branchPrefix    = branchPrefix;
        this.workers         = Executors.newFixedThreadPool(workerCount);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Run one execution to completion.
     *
     * @throws ExecutionFailedException on any failure; the Experiment (if one
     *         was created) is already marked FAILED and its id is attached
     */
    public ExecutionResult execute(ExecutionRequest request) {
        validate(request);

        Experiment experiment = experimentRepo.save(new Experiment(
                request.proposalId(), request.instruction(), request.updateBlock(),
                request.repoFullname(), request.filePath(), request.baseBranch()));

        MDC.put("experimentId", String.valueOf(experiment.getId()));
        MDC.put("repo", request.repoFullname());
        if (request.proposalId() != null) MDC.put("proposalId", request.proposalId());
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        PipelineState state = new PipelineState();
        try {
            log.info("Executing '{}' on {}:{} (base {})", request.instruction(),
                    request.repoFullname(), request.filePath(), request.baseBranch());

            Future<ExecutionResult> future = workers.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return runPipeline(request, experiment, state);
                } finally {
                    MDC.clear();
                }
            });

            ExecutionResult result = await(future, request, state);

            experiment.complete(result.prUrl(), result.branch(), result.diffSummary());
            experimentRepo.save(experiment);
            log.info("Experiment {} COMPLETED: {}", experiment.getId(), result.prUrl());
            return result;

        } catch (ExecutionFailedException e) {
            e.setExperimentId(experiment.getId());
            experiment.setBranch(state.branch);
            experiment.setDiffSummary(state.diffSummary);
            experiment.fail(e.getKind().name(), e.getMessage());
            experimentRepo.save(experiment);
            log.warn("Experiment {} FAILED: {}", experiment.getId(), e.getMessage());
            throw e;
        } finally {
            MDC.remove("experimentId");
            MDC.remove("repo");
            MDC.remove("proposalId");
        }
    }

    private ExecutionResult await(Future<ExecutionResult> future, ExecutionRequest request, PipelineState state) {
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw failure(Kind.TIMEOUT, "Execution exceeded the deadline of " + deadline.toSeconds() + "s",
                    request, state, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw failure(Kind.TIMEOUT, "Interrupted while waiting for the execution", request, state, e);
        } catch (ExecutionException e) {
            throw translate(e.getCause(), request, state);
        }
    }

    // ------------------------------------------------------------------
    // Pipeline (runs on a worker thread)
    // ------------------------------------------------------------------

    private ExecutionResult runPipeline(ExecutionRequest request, Experiment experiment, PipelineState state) {
        try (GitWorkspace workspace = stage("clone", () -> workspaces.cloneRepository(request.repoFullname()))) {

            stage("checkout", () -> {
                branchAllocator.checkoutBase(workspace, request.baseBranch());
                return request.baseBranch();
            });

            Path file = workspace.resolve(request.filePath());
            String original = read(file, request, state);

            String merged = stage("merge",
                    () -> mergeClient.merge(request.instruction(), original, request.updateBlock()));
            if (merged.equals(original)) {
                throw failure(Kind.NO_CHANGE_DETECTED,
                        "Merged code is identical to the original; nothing to commit", request, state, null);
            }
            write(file, merged, request, state);

            String diff = UnifiedDiff.of(request.filePath(), original, merged);
            state.diffSummary = UnifiedDiff.changedLines(diff) + " lines changed";

            String wanted = branchPrefix + Slugs.slugify(request.instruction());
            state.branch(stage("branch",
                    () -> branchAllocator.allocate(workspace, request.baseBranch(), wanted)), experiment);

            Committer.Outcome outcome = stage("push",
                    () -> commitAndPush(workspace, wanted, "Northstar: " + request.instruction(), experiment, state));
            if (outcome == Committer.Outcome.NO_CHANGE) {
                throw failure(Kind.NO_CHANGE_DETECTED,
                        "Working tree is clean after writing the merged file", request, state, null);
            }

            String prUrl = stage("pull_request", () -> pullRequests.open(
                    request.repoFullname(), state.branch, request.baseBranch(),
                    "Northstar Experiment: " + request.instruction(),
                    pullRequestBody(request, diff)));

            return new ExecutionResult(experiment.getId(), prUrl, state.branch,
                    List.of(request.filePath()), state.diffSummary);
        }
    }

    private Committer.Outcome commitAndPush(GitWorkspace workspace, String wanted, String message,
                                            Experiment experiment, PipelineState state) {
        try {
            return committer.commitAndPush(workspace, state.branch, message);
        } catch (GitException e) {
            if (e.getKind() != GitException.Kind.PUSH_REJECTED) throw e;
            log.warn("Push of '{}' rejected, probing for another branch name", state.branch);
            state.branch(branchAllocator.reallocate(workspace, state.branch, wanted), experiment);
            committer.push(workspace, state.branch);
            return Committer.Outcome.PUSHED;
        }
    }

    private String read(Path file, ExecutionRequest request, PipelineState state) {
        if (!Files.isRegularFile(file)) {
            throw failure(Kind.FILE_NOT_FOUND,
                    "File '" + request.filePath() + "' does not exist in " + request.repoFullname(),
                    request, state, null);
        }
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw failure(Kind.FILE_NOT_FOUND, "Could not read '" + request.filePath() + "': " + e.getMessage(),
                    request, state, e);
        }
    }

    private void write(Path file, String content, ExecutionRequest request, PipelineState state) {
        try {
            Files.writeString(file, content);
        } catch (IOException e) {
            throw failure(Kind.INTERNAL, "Could not write '" + request.filePath() + "': " + e.getMessage(),
                    request, state, e);
        }
    }

    static String pullRequestBody(ExecutionRequest request, String diff) {
        String shown = diff.length() > MAX_DIFF_IN_BODY
                ? diff.substring(0, MAX_DIFF_IN_BODY) + "\n... (diff truncated)"
                : diff;
        return "## Northstar Experiment\n\n"
                + "**Instruction:** " + request.instruction() + "\n\n"
                + "**File:** `" + request.filePath() + "`\n\n"
                + "### Changes\n\n"
                + "```diff\n" + shown + "\n```\n\n"
                + "---\n"
                + "Opened automatically after the proposal was approved.\n";
    }

    /** Run one stage and record its duration, tagged with the outcome. */
    private <T> T stage(String name, Supplier<T> body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            T value = body.get();
            outcome = "success";
            return value;
        } finally {
            sample.stop(Timer.builder(STAGE_TIMER)
                    .tag("stage", name)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    // ------------------------------------------------------------------
    // Validation and error translation
    // ------------------------------------------------------------------

    private static void validate(ExecutionRequest request) {
        String problem = null;
        if (isBlank(request.instruction()))       problem = "instruction is required";
        else if (isBlank(request.repoFullname())) problem = "repoFullname is required";
        else if (isBlank(request.filePath()))     problem = "filePath is required";
        else if (request.repoFullname().split("/", -1).length != 2) {
            problem = "repoFullname must look like owner/name, got '" + request.repoFullname() + "'";
        }
        if (problem != null) {
            throw new ExecutionFailedException(Kind.INVALID_REQUEST, problem,
                    request.repoFullname(), null, request.instruction(), null);
        }
    }

    private static ExecutionFailedException translate(Throwable cause, ExecutionRequest request, PipelineState state) {
        if (cause instanceof ExecutionFailedException e) return e;
        if (cause instanceof MergeException e) {
            Kind kind = switch (e.getKind()) {
                case SERVICE_ERROR -> Kind.MERGE_SERVICE_ERROR;
                case TIMEOUT       -> Kind.TIMEOUT;
                case EMPTY_RESULT  -> Kind.EMPTY_MERGE_RESULT;
            };
            return failure(kind, withoutKindPrefix(e.getMessage()), request, state, e);
        }
        if (cause instanceof GitException e) {
            return failure(Kind.valueOf(e.getKind().name()), withoutKindPrefix(e.getMessage()), request, state, e);
        }
        if (cause instanceof PullRequestException e) {
            return failure(Kind.valueOf(e.getKind().name()), withoutKindPrefix(e.getMessage()), request, state, e);
        }
        if (cause instanceof IllegalArgumentException e) {
            return failure(Kind.INVALID_REQUEST, e.getMessage(), request, state, e);
        }
        log.error("Unexpected error during execution", cause);
        return failure(Kind.INTERNAL, "Unexpected error: " + cause, request, state, cause);
    }

    private static ExecutionFailedException failure(Kind kind, String message, ExecutionRequest request,
                                                    PipelineState state, Throwable cause) {
        return new ExecutionFailedException(kind, message, request.repoFullname(), state.branch,
                request.instruction(), cause);
    }

    /** Component exceptions prefix their message with "[KIND] "; the wrapper adds its own. */
    static String withoutKindPrefix(String message) {
        if (message == null || !message.startsWith("[")) return message;
        int end = message.indexOf("] ");
        return end < 0 ? message : message.substring(end + 2);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** What the worker has produced so far; read by the caller when the pipeline fails. */
    private final class PipelineState {
        volatile String branch;
        volatile String diffSummary;

        void branch(String allocated, Experiment experiment) {
            this.branch = allocated;
            experimentRepo.recordBranch(experiment.getId(), allocated);
        }
    }
}

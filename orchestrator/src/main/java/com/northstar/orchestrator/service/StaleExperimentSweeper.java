package com.northstar.orchestrator.service;

import com.northstar.orchestrator.model.Experiment;
import com.northstar.orchestrator.model.ExperimentStatus;
import com.northstar.orchestrator.repository.ExperimentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails experiments that are still RUNNING long after any execution could
 * have finished, e.g. because the process was killed mid-pipeline.
 *
 * stale-after must stay well above the execution deadline.
 */
@Component
@EnableScheduling
public class StaleExperimentSweeper {

    private static final Logger log = LoggerFactory.getLogger(StaleExperimentSweeper.class);

    private final ExperimentRepository experimentRepo;
    private final Duration             staleAfter;

    public StaleExperimentSweeper(ExperimentRepository experimentRepo,
                                  @Value("${northstar.execution.stale-after:15m}") Duration staleAfter) {
        this.experimentRepo = experimentRepo;
        this.staleAfter     = staleAfter;
    }

    @Scheduled(fixedDelay = 60_000, initialDelay = 30_000)
    @Transactional
    public int sweep() {
        Instant cutoff = Instant.now().minus(staleAfter);
        List<Experiment> stale = experimentRepo.findByStatusAndCreatedAtBefore(ExperimentStatus.RUNNING, cutoff);
        for (Experiment experiment : stale) {
            log.warn("Experiment {} still RUNNING since {}, marking FAILED", experiment.getId(), experiment.getCreatedAt());
            experiment.fail(ExecutionFailedException.Kind.TIMEOUT.name(),
                    "[TIMEOUT] Execution abandoned: still running after " + staleAfter.toMinutes() + " minutes");
            experimentRepo.save(experiment);
        }
        return stale.size();
    }
}

package com.northstar.orchestrator.model;

/**
 * States of one execution attempt.
 *
 * An Experiment is created RUNNING before any git or PR side effect and ends
 * COMPLETED (with a PR URL) or FAILED (with a reason). Nothing else.
 */
public enum ExperimentStatus {
    RUNNING,
    COMPLETED,
    FAILED
}

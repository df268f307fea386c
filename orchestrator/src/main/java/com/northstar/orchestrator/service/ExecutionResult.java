package com.northstar.orchestrator.service;

import java.util.List;
import java.util.UUID;

/** Outcome of a successful execution. */
public record ExecutionResult(UUID         experimentId,
                              String       prUrl,
                              String       branch,
                              List<String> filesModified,
                              String       diffSummary) {}

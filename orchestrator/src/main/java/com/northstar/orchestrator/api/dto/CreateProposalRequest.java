package com.northstar.orchestrator.api.dto;

/**
 * Request body for POST /proposals.
 *
 * rawText is the model's unedited output; oauthSessionId is optional.
 */
public record CreateProposalRequest(String rawText, String repoFullname, String oauthSessionId) {}

package com.northstar.orchestrator.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A validated proposal recovered from model output.
 *
 * Field names on the wire are snake_case, matching what the model is asked
 * to produce. {@code proposalId} is whatever id the model chose (often absent)
 * and is never used as the persisted proposal id.
 */
@JsonPropertyOrder({"proposal_id", "idea_summary", "rationale", "category",
        "expected_impact", "technical_plan", "update_block", "confidence"})
public record ProposalFields(
        @JsonProperty("proposal_id")     String        proposalId,
        @JsonProperty("idea_summary")    String        ideaSummary,
        @JsonProperty("rationale")       String        rationale,
        @JsonProperty("category")        String        category,
        @JsonProperty("expected_impact") Impact        expectedImpact,
        @JsonProperty("technical_plan")  List<PlanStep> technicalPlan,
        @JsonProperty("update_block")    String        updateBlock,
        @JsonProperty("confidence")      double        confidence
) {

    public ProposalFields {
        technicalPlan = technicalPlan == null ? List.of() : List.copyOf(technicalPlan);
        if (updateBlock == null) updateBlock = "";
    }

    /** Expected movement of a product metric, e.g. {@code checkout_conversion +4.8%}. */
    public record Impact(
            @JsonProperty("metric")    String metric,
            @JsonProperty("delta_pct") double deltaPct) {}

    /** One entry of the technical plan: which file to touch and what to do there. */
    public record PlanStep(
            @JsonProperty("file")   String file,
            @JsonProperty("action") String action) {}

    /** The file named by the first plan entry, which is what gets executed. */
    public String targetFile() {
        return technicalPlan.isEmpty() ? null : technicalPlan.get(0).file();
    }
}

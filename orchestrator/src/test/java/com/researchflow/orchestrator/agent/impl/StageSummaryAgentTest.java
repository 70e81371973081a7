package com.researchflow.orchestrator.agent.impl;

import com.researchflow.orchestrator.agent.AgentReply;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StageSummaryAgentTest {

    private final StageSummaryAgent agent = new StageSummaryAgent();

    @Test
    void summarizesPriorOutputs() {
        Map<String, Object> prior = new LinkedHashMap<>();
        prior.put("lit_retrieval", Map.of("papers", 42, "query", "hip fracture"));
        prior.put("lit_triage", Map.of("partial", true, "error_code", "TRANSIENT_ERROR", "output", Map.of()));

        AgentReply reply = agent.run(StageSummaryAgent.TASK_TYPE,
                Map.of("workflow_id", "wf-001", "stage_id", 2, "prior_outputs", prior));

        assertThat(reply.success()).isTrue();
        assertThat(reply.output())
                .containsEntry("workflow_id", "wf-001")
                .containsEntry("completed_steps", List.of("lit_retrieval"))
                .containsEntry("partial_steps", List.of("lit_triage"));
        assertThat((Map<String, Object>) reply.output().get("output_fields"))
                .containsEntry("lit_retrieval", List.of("papers", "query"));
    }

    @Test
    void wrongTaskType_isAnAgentLevelFailure() {
        AgentReply reply = agent.run("CLAIM_VERIFY", Map.of("prior_outputs", Map.of()));

        assertThat(reply.success()).isFalse();
    }
}

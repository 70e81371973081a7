package com.researchflow.orchestrator.agent.impl;

import com.researchflow.orchestrator.agent.AgentReply;
import com.researchflow.orchestrator.agent.LocalAgent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process agent that closes a stage with an overview of what the earlier
 * steps produced.
 *
 * Reads {@code prior_outputs} from the step input and reports which steps
 * delivered output, which only delivered a partial (best-effort) result, and
 * the top-level keys each output carries. Nothing leaves the JVM, so this
 * agent sits outside the PHI gate.
 */
@Component
public class StageSummaryAgent implements LocalAgent {

    public static final String NAME      = "stage-summary";
    public static final String TASK_TYPE = "STAGE_SUMMARY";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AgentReply run(String taskType, Map<String, Object> inputs) {
        if (!TASK_TYPE.equals(taskType)) {
            return AgentReply.failed("Unsupported task type: " + taskType);
        }
        Object prior = inputs.get("prior_outputs");
        if (!(prior instanceof Map<?, ?> priorOutputs)) {
            return AgentReply.failed("Missing prior_outputs");
        }

        List<String> completed = new ArrayList<>();
        List<String> partial   = new ArrayList<>();
        Map<String, Object> fields = new LinkedHashMap<>();

        priorOutputs.forEach((step, output) -> {
            String name = String.valueOf(step);
            if (output instanceof Map<?, ?> map && Boolean.TRUE.equals(map.get("partial"))) {
                partial.add(name);
            } else {
                completed.add(name);
            }
            fields.put(name, output instanceof Map<?, ?> m
                    ? m.keySet().stream().map(String::valueOf).sorted().toList()
                    : List.of());
        });

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("workflow_id",     inputs.get("workflow_id"));
        output.put("stage_id",        inputs.get("stage_id"));
        output.put("completed_steps", completed);
        output.put("partial_steps",   partial);
        output.put("output_fields",   fields);
        return AgentReply.ok(output);
    }
}

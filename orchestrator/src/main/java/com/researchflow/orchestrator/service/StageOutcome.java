package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.model.ErrorCode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one attempt at a stage produced.
 *
 * @param errorCode  null when completed
 * @param failedStep the strict step that aborted the attempt, if any
 * @param artifacts  references of every artifact the attempt produced or reused
 * @param outputs    step name → output; best-effort failures map to a partial marker
 * @param warnings   one line per best-effort failure
 */
public record StageOutcome(boolean completed,
                           ErrorCode errorCode,
                           String message,
                           String failedStep,
                           List<String> artifacts,
                           Map<String, Object> outputs,
                           List<String> warnings) {

    public static StageOutcome completed(List<String> artifacts, Map<String, Object> outputs, List<String> warnings) {
        return new StageOutcome(true, null, null, null, List.copyOf(artifacts), outputs, List.copyOf(warnings));
    }

    public static StageOutcome failed(ErrorCode code, String message, String failedStep,
                                      List<String> artifacts, Map<String, Object> outputs, List<String> warnings) {
        return new StageOutcome(false, code, message, failedStep, List.copyOf(artifacts), outputs, List.copyOf(warnings));
    }

    /** Result summary persisted on the job row. */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("artifacts", artifacts);
        summary.put("outputs",   outputs);
        summary.put("warnings",  warnings);
        if (failedStep != null) {
            summary.put("failed_step", failedStep);
        }
        return summary;
    }
}

package com.researchflow.orchestrator.router;

import com.researchflow.orchestrator.model.ErrorCode;

import java.util.Map;

/**
 * Normalized outcome of one dispatch. On failure the message is written by
 * the orchestrator; agent error text and request content never appear in it.
 *
 * A failed result keeps whatever output the agent returned alongside its
 * failure, so a best-effort step can pass it on as partial output.
 */
public record DispatchResult(boolean success, Map<String, Object> output, ErrorCode errorCode, String message) {

    public static DispatchResult ok(Map<String, Object> output) {
        return new DispatchResult(true, output == null ? Map.of() : output, null, null);
    }

    public static DispatchResult failure(ErrorCode code, String message) {
        return failure(code, message, null);
    }

    public static DispatchResult failure(ErrorCode code, String message, Map<String, Object> partialOutput) {
        return new DispatchResult(false, partialOutput == null ? Map.of() : partialOutput, code, message);
    }

    /** Tag value for metrics and logs. */
    public String outcome() {
        return success ? "success" : errorCode.name().toLowerCase();
    }
}

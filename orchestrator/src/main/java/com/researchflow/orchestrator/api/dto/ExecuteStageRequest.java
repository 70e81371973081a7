package com.researchflow.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request body for POST /stages/{stage}/execute.
 *
 * Named: workflow_id (required), mode (optional, DEMO or LIVE).
 * Every other top-level property is a stage input field and is forwarded to
 * the agents as the step input's {@code request}. Which of them are required
 * depends on the stage.
 */
public class ExecuteStageRequest {

    private String workflowId;
    private String mode;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public String getWorkflowId()              { return workflowId; }
    public void   setWorkflowId(String id)     { this.workflowId = id; }
    public String getMode()                    { return mode; }
    public void   setMode(String mode)         { this.mode = mode; }

    public Map<String, Object> getFields() { return fields; }

    @JsonAnySetter
    public void setField(String name, Object value) {
        fields.put(name, value);
    }
}

package com.researchflow.orchestrator.agent;

/**
 * No endpoint in the registry serves the requested task type.
 */
public class UnmappedTaskTypeException extends RuntimeException {

    private final String taskType;

    public UnmappedTaskTypeException(String taskType) {
        super("No agent endpoint is registered for task type: " + taskType);
        this.taskType = taskType;
    }

    public String getTaskType() { return taskType; }
}

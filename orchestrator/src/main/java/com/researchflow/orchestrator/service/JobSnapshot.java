package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.model.Job;
import com.researchflow.orchestrator.model.Step;

import java.util.List;
import java.util.Map;

/**
 * Persisted state of a job: the row, the steps of its latest attempt and
 * the decoded result summary (null until the job finishes).
 */
public record JobSnapshot(Job job, List<Step> steps, Map<String, Object> result) {}

package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.model.Job;

/**
 * @param deduplicated true when an existing job with the same idempotency key was returned
 */
public record SubmissionResult(Job job, boolean deduplicated) {}

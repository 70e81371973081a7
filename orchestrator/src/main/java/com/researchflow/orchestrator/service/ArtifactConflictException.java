package com.researchflow.orchestrator.service;

/**
 * Another job already wrote the artifact for this (workflow, stage, step) key.
 */
public class ArtifactConflictException extends RuntimeException {

    public ArtifactConflictException(String key, Throwable cause) {
        super("Artifact " + key + " was written concurrently by another job", cause);
    }
}

package com.researchflow.orchestrator.phi;

/**
 * The external scan service could not be reached or answered with something
 * other than a scan result.
 */
public class PhiGateUnavailableException extends RuntimeException {

    public PhiGateUnavailableException(String message) {
        super(message);
    }

    public PhiGateUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.researchflow.orchestrator.phi;

/**
 * Safety gate consulted before any text leaves the process.
 *
 * Implementations must not log or return the matched text.
 */
public interface PhiGate {

    /**
     * @throws PhiGateUnavailableException when the scan could not be performed;
     *         callers treat this as "not cleared" and send nothing
     */
    PhiScanResult scan(String text);
}

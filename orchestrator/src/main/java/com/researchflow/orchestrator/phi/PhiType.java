package com.researchflow.orchestrator.phi;

/** Category of identifier a span was flagged as. */
public enum PhiType {
    SSN,
    PHONE,
    EMAIL,
    MRN,
    DATE_OF_BIRTH,
    CUSTOM
}

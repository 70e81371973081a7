package com.researchflow.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Operating mode a stage runs under.
 *
 * DEMO tolerates best-effort failures on steps marked as such in the stage
 * catalog. LIVE treats every step as strict.
 */
public enum GovernanceMode {
    DEMO,
    LIVE;

    /** Case-insensitive lookup; empty for anything that is not a known mode. */
    public static Optional<GovernanceMode> parse(String raw) {
        if (raw == null) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

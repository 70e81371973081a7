package com.researchflow.orchestrator.phi;

import java.util.List;

/**
 * Outcome of a PHI scan. Spans carry positions and categories only; the
 * matched text is never part of the result.
 */
public record PhiScanResult(boolean flagged, List<Span> spans) {

    private static final PhiScanResult CLEAN = new PhiScanResult(false, List.of());

    public PhiScanResult {
        spans = List.copyOf(spans);
    }

    public static PhiScanResult clean() {
        return CLEAN;
    }

    public static PhiScanResult of(List<Span> spans) {
        return spans.isEmpty() ? CLEAN : new PhiScanResult(true, spans);
    }

    /** Half-open character range {@code [start, end)} of a flagged identifier. */
    public record Span(PhiType type, int start, int end) {}
}

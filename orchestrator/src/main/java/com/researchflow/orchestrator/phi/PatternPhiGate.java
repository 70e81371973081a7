package com.researchflow.orchestrator.phi;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-process PHI scanner built on regular expressions.
 *
 * Flags:
 *   - social security numbers ({@code 123-45-6789}, {@code 123 45 6789})
 *   - formatted phone numbers ({@code 555-123-4567}, {@code (555) 123-4567}, {@code 555.123.4567})
 *   - e-mail addresses
 *   - labelled record numbers ({@code MRN: 1234}, {@code Medical Record Number 1234}, {@code Patient ID 1234})
 *   - labelled birth dates ({@code DOB: 01/02/1980})
 *   - any extra expressions configured under {@code researchflow.phi.extra-patterns}
 *
 * Bare dates and years are not flagged: literature and methods text is full of them.
 */
public class PatternPhiGate implements PhiGate {

    private static final Map<PhiType, List<Pattern>> BUILT_IN = Map.of(
            PhiType.SSN, List.of(
                    Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"),
                    Pattern.compile("\\b\\d{3} \\d{2} \\d{4}\\b")),
            PhiType.PHONE, List.of(
                    Pattern.compile("\\b\\d{3}-\\d{3}-\\d{4}\\b"),
                    Pattern.compile("\\(\\d{3}\\)\\s?\\d{3}-\\d{4}\\b"),
                    Pattern.compile("\\b\\d{3}\\.\\d{3}\\.\\d{4}\\b")),
            PhiType.EMAIL, List.of(
                    Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b")),
            PhiType.MRN, List.of(
                    Pattern.compile("\\bMRN[:#\\s]*\\d+\\b", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\bMedical\\s+Record\\s+Number[:#\\s]*\\d+\\b", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\bPatient\\s+ID[:#\\s]*\\d+\\b", Pattern.CASE_INSENSITIVE)),
            PhiType.DATE_OF_BIRTH, List.of(
                    Pattern.compile("\\b(DOB|Date\\s+of\\s+Birth)[:\\s]*\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b",
                            Pattern.CASE_INSENSITIVE)));

    private final List<Pattern> extraPatterns;

    public PatternPhiGate() {
        this(List.of());
    }

    public PatternPhiGate(List<String> extraPatterns) {
        this.extraPatterns = extraPatterns.stream().map(Pattern::compile).toList();
    }

    @Override
    public PhiScanResult scan(String text) {
        if (text == null || text.isBlank()) {
            return PhiScanResult.clean();
        }
        List<PhiScanResult.Span> spans = new ArrayList<>();
        BUILT_IN.forEach((type, patterns) -> patterns.forEach(p -> collect(p, type, text, spans)));
        extraPatterns.forEach(p -> collect(p, PhiType.CUSTOM, text, spans));
        spans.sort(Comparator.comparingInt(PhiScanResult.Span::start));
        return PhiScanResult.of(spans);
    }

    private static void collect(Pattern pattern, PhiType type, String text, List<PhiScanResult.Span> out) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            out.add(new PhiScanResult.Span(type, m.start(), m.end()));
        }
    }
}

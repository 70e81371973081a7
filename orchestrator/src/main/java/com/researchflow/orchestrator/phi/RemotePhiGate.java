package com.researchflow.orchestrator.phi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client for an external PHI scan service.
 *
 * Contract: {@code POST {scanner}/scan {"text": ...}} answers
 * {@code {"flagged": bool, "spans": [{"type", "start", "end"}]}}.
 *
 * Any failure to obtain a verdict raises {@link PhiGateUnavailableException};
 * the gate never reports "clean" without an answer from the service.
 */
public class RemotePhiGate implements PhiGate {

    private static final Logger log = LoggerFactory.getLogger(RemotePhiGate.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public RemotePhiGate(String baseUrl, Duration timeout, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public PhiScanResult scan(String text) {
        if (text == null || text.isBlank()) {
            return PhiScanResult.clean();
        }
        String body;
        try {
            body = json.writeValueAsString(Map.of("text", text));
        } catch (JsonProcessingException e) {
            throw new PhiGateUnavailableException("Could not encode scan request", e);
        }

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/scan"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PhiGateUnavailableException("PHI scan interrupted", e);
        } catch (Exception e) {
            // Only the exception type: messages from the HTTP stack can echo request data.
            log.warn("PHI scanner unreachable: {}", e.getClass().getSimpleName());
            throw new PhiGateUnavailableException("PHI scanner unreachable", e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            log.warn("PHI scanner answered HTTP {}", resp.statusCode());
            throw new PhiGateUnavailableException("PHI scanner answered HTTP " + resp.statusCode());
        }
        try {
            ScanResponse parsed = json.readValue(resp.body(), ScanResponse.class);
            if (!parsed.flagged()) {
                return PhiScanResult.clean();
            }
            List<PhiScanResult.Span> spans = parsed.spans() == null ? List.of() : parsed.spans().stream()
                    .map(s -> new PhiScanResult.Span(typeOf(s.type()), s.start(), s.end()))
                    .toList();
            // A flagged verdict without spans is still a block.
            return new PhiScanResult(true, spans);
        } catch (JsonProcessingException e) {
            throw new PhiGateUnavailableException("PHI scanner returned a malformed body", e);
        }
    }

    private static PhiType typeOf(String raw) {
        if (raw == null) return PhiType.CUSTOM;
        try {
            return PhiType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PhiType.CUSTOM;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScanResponse(boolean flagged, List<RemoteSpan> spans) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RemoteSpan(String type, int start, int end) {}
}

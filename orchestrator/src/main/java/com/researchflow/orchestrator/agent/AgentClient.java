package com.researchflow.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchflow.orchestrator.config.ResearchFlowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for remote agent proxies.
 *
 * Two calls per endpoint:
 * <pre>
 *   POST {address}/run     {"task_type": ..., "inputs": {...}}  →  {"success", "output" | "error"}
 *   GET  {address}/health                                        →  {"status": "ok"}
 * </pre>
 *
 * Logs carry endpoint, path, status and latency only. Request and response
 * bodies may contain research data and are never logged.
 */
@Component
public class AgentClient {

    private static final Logger log = LoggerFactory.getLogger(AgentClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;

    @Autowired
    public AgentClient(ResearchFlowProperties properties, ObjectMapper objectMapper) {
        this(properties.getDispatch().getConnectTimeout(), objectMapper);
    }

    public AgentClient(Duration connectTimeout, ObjectMapper objectMapper) {
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // agent proxies run plain HTTP/1.1 servers
                .connectTimeout(connectTimeout)
                .build();
    }

    // ------------------------------------------------------------------
    // Task execution
    // ------------------------------------------------------------------

    /**
     * Run one task on a remote agent.
     *
     * @throws AgentCallException for transport failures, non-2xx replies and unparseable bodies
     */
    public AgentReply run(AgentEndpoint endpoint, String taskType, Map<String, Object> inputs, Duration timeout) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("task_type", taskType);
        request.put("inputs",    inputs);

        String respBody = send(endpoint, "/run", post(endpoint, "/run", toJson(request), timeout));
        try {
            AgentReply reply = json.readValue(respBody, AgentReply.class);
            if (reply == null) {
                throw new AgentCallException(AgentCallException.Kind.MALFORMED_RESPONSE,
                        "Empty reply from endpoint '" + endpoint.id() + "'");
            }
            return reply;
        } catch (JsonProcessingException e) {
            throw new AgentCallException(AgentCallException.Kind.MALFORMED_RESPONSE,
                    "Unparseable reply from endpoint '" + endpoint.id() + "'", e);
        }
    }

    // ------------------------------------------------------------------
    // Health check
    // ------------------------------------------------------------------

    /** True when {@code GET /health} answers 2xx within the timeout. */
    public boolean checkHealth(AgentEndpoint endpoint, Duration timeout) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl(endpoint) + "/health"))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            send(endpoint, "/health", req);
            return true;
        } catch (AgentCallException e) {
            log.debug("Health check failed for '{}': {}", endpoint.id(), e.getKind());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest post(AgentEndpoint endpoint, String path, String jsonBody, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl(endpoint) + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
    }

    /** Send and classify; returns the body of a 2xx reply. */
    private String send(AgentEndpoint endpoint, String path, HttpRequest req) {
        long started = System.nanoTime();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new AgentCallException(AgentCallException.Kind.TIMEOUT,
                    "Endpoint '" + endpoint.id() + "' did not answer " + path + " in time", e);
        } catch (IOException e) {
            throw new AgentCallException(AgentCallException.Kind.NETWORK,
                    "Endpoint '" + endpoint.id() + "' unreachable on " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCallException(AgentCallException.Kind.TIMEOUT,
                    "Call to endpoint '" + endpoint.id() + "' interrupted", e);
        }

        long latencyMs = (System.nanoTime() - started) / 1_000_000;
        int status = resp.statusCode();
        log.debug("Agent call endpoint={} path={} status={} latencyMs={}", endpoint.id(), path, status, latencyMs);

        if (status >= 200 && status < 300) {
            return resp.body();
        }
        AgentCallException.Kind kind = (status >= 500 || status == 429 || status == 408)
                ? AgentCallException.Kind.SERVER_ERROR
                : AgentCallException.Kind.REJECTED;
        throw new AgentCallException(kind,
                "Endpoint '" + endpoint.id() + "' answered HTTP " + status + " on " + path);
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AgentCallException(AgentCallException.Kind.MALFORMED_RESPONSE,
                    "Could not encode agent request", e);
        }
    }

    private static String baseUrl(AgentEndpoint endpoint) {
        String address = endpoint.address();
        return address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
    }
}

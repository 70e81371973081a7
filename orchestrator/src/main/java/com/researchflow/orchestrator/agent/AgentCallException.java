package com.researchflow.orchestrator.agent;

/**
 * A call to an agent endpoint did not produce a usable reply.
 *
 * The kind decides both the error code the dispatcher reports and whether
 * the endpoint's circuit breaker counts the call as a failure.
 */
public class AgentCallException extends RuntimeException {

    public enum Kind {
        /** Connection refused, reset, DNS failure. */
        NETWORK,
        /** No reply within the call timeout. */
        TIMEOUT,
        /** HTTP 5xx, 429 or 408. */
        SERVER_ERROR,
        /** Any other non-2xx reply. */
        REJECTED,
        /** 2xx reply whose body is not an agent reply. */
        MALFORMED_RESPONSE;

        public boolean isTransportFailure() {
            return this == NETWORK || this == TIMEOUT || this == SERVER_ERROR;
        }
    }

    private final Kind kind;

    public AgentCallException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public AgentCallException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}

package com.trustplatform.common.exception;

/**
 * Base of every error the engine raises. The message is prefixed with
 * {@code [agentId]} so a log line identifies the agent without MDC;
 * {@link #getAgentId()} returns the bare id for callers that branch on it.
 */
public class ReputationException extends RuntimeException {
    private final String agentId;

    public ReputationException(String agentId, String message) {
        super("[" + agentId + "] " + message);
        this.agentId = agentId;
    }

    public ReputationException(String agentId, String message, Throwable cause) {
        super("[" + agentId + "] " + message, cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}

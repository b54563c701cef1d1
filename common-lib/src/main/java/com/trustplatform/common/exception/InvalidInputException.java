package com.trustplatform.common.exception;

/**
 * Raised at the engine boundary when a caller-supplied value cannot be scored:
 * out-of-range confidence or difficulty, a missing timestamp, an out-of-order
 * timestamp, or an administrative score outside the configured bounds.
 *
 * <p>Nothing is written to the store when this is thrown.
 */
public class InvalidInputException extends ReputationException {

    public InvalidInputException(String agentId, String message) {
        super(agentId, message);
    }
}

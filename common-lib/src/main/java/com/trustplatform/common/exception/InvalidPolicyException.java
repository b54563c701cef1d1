package com.trustplatform.common.exception;

/**
 * Raised when a {@link com.trustplatform.common.policy.ReputationPolicy} is
 * constructed with values that break its invariants.
 */
public class InvalidPolicyException extends ReputationException {

    private static final String SCOPE = "policy";

    public InvalidPolicyException(String message) {
        super(SCOPE, message);
    }
}

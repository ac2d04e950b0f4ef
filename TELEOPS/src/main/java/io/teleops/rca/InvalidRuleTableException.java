package io.teleops.rca;

/**
 * Thrown when a rule table fails validation. The table is never installed.
 */
public class InvalidRuleTableException extends RuntimeException {

    public InvalidRuleTableException(String message) {
        super(message);
    }
}

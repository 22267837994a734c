package org.processgraph.reasoning.redistribution;

/**
 * A redistribution request that cannot be carried out. Raised before anything is changed.
 */
public class RedistributionValidationException extends RuntimeException {
    public RedistributionValidationException(String message) {
        super(message);
    }
}

package com.arbor.synth.api.exceptions;

/**
 * Thrown when a constraint refers to rules the grammar does not have, or uses
 * a template whose shape cannot fit the referenced rules.
 */
public class ConstraintDomainException extends ArborException {

    public ConstraintDomainException(String message) {
        super(message);
    }

    public ConstraintDomainException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.arbor.synth.api.exceptions;

/**
 * Thrown when a grammar is structurally invalid: a rule refers to an unknown
 * category, a rule index does not exist, or an enumeration starts from a
 * category the grammar never defines.
 */
public class GrammarStructureException extends ArborException {

    public GrammarStructureException(String message) {
        super(message);
    }

    public GrammarStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}

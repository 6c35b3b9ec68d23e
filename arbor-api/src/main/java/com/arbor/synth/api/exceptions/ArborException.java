package com.arbor.synth.api.exceptions;

/**
 * Base class of all errors raised by the grammar model and the search engine.
 *
 * Unchecked, so callers building grammars or enumerators are not forced into
 * checked exception handling. Infeasible search branches are never reported
 * through exceptions.
 */
public class ArborException extends RuntimeException {

    public ArborException(String message) {
        super(message);
    }

    public ArborException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArborException(Throwable cause) {
        super(cause);
    }
}

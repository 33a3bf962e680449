package com.substitution.solver.index;

/**
 * Raised when a dictionary source cannot be read.
 */
public class DictionaryLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DictionaryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.pragmatica.regex.error;

/**
 * Raised when a grammar fails validation.
 */
public final class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }
}

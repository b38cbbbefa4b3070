package com.jolly.card;

/**
 * Exception thrown when card notation cannot be parsed.
 */
public class CardNotationException extends Exception {
    public CardNotationException(String message) {
        super(message);
    }

    public CardNotationException(String message, Throwable cause) {
        super(message, cause);
    }
}

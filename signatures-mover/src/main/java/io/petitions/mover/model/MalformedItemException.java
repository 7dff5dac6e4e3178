package io.petitions.mover.model;

/**
 * Raised when a queue payload cannot be decoded into a {@link SignatureRecord}.
 * There is nothing to retry for such an item.
 */
public class MalformedItemException extends Exception {

    public MalformedItemException(String message) {
        super(message);
    }

    public MalformedItemException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.unifi.petri.exceptions;

/**
 * Base type of every error raised while building, loading or parsing a net.
 * Unchecked: an invalid net description is a caller error, not a recoverable condition.
 */
public class PetriNetException extends IllegalArgumentException {

    public PetriNetException(String message) {
        super(message);
    }

    public PetriNetException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.unifi.petri.exceptions;

public class InvalidMarkingException extends PetriNetException {

    public InvalidMarkingException(String place, int tokens) {
        super("Place " + place + " cannot hold a negative number of tokens (" + tokens + ")");
    }

    public InvalidMarkingException(String message) {
        super(message);
    }

    public InvalidMarkingException(String message, Throwable cause) {
        super(message, cause);
    }
}

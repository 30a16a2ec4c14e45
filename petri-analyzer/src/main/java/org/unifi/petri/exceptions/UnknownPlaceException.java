package org.unifi.petri.exceptions;

/**
 * A marking entry names something that is not a declared place.
 */
public class UnknownPlaceException extends UnknownNodeException {

    public UnknownPlaceException(String name) {
        super("Marking specified for non-existent place: " + name, name);
    }
}

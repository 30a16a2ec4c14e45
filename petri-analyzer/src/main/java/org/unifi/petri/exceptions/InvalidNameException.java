package org.unifi.petri.exceptions;

public class InvalidNameException extends PetriNetException {

    public InvalidNameException(String name) {
        super("Invalid node name: '" + name + "'");
    }
}

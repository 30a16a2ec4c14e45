package org.unifi.petri.exceptions;

public class UnknownNodeException extends PetriNetException {

    private final String name;

    public UnknownNodeException(String name) {
        this("Unknown node: " + name, name);
    }

    protected UnknownNodeException(String message, String name) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

package org.unifi.petri.exceptions;

public class DuplicateNameException extends PetriNetException {

    private final String name;

    public DuplicateNameException(String name) {
        super("Name already used by a place or a transition: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

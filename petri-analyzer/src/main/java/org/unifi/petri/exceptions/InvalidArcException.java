package org.unifi.petri.exceptions;

public class InvalidArcException extends PetriNetException {

    private final String source;
    private final String target;

    public InvalidArcException(String source, String target) {
        super("An arc must connect a place and a transition: " + source + "->" + target);
        this.source = source;
        this.target = target;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }
}

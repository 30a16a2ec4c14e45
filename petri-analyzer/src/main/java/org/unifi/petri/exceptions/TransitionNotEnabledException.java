package org.unifi.petri.exceptions;

public class TransitionNotEnabledException extends PetriNetException {

    private final String transition;

    public TransitionNotEnabledException(String transition) {
        super("Transition " + transition + " is not enabled in the current marking");
        this.transition = transition;
    }

    public String getTransition() {
        return transition;
    }
}

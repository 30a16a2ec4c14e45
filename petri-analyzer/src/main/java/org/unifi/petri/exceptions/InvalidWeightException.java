package org.unifi.petri.exceptions;

public class InvalidWeightException extends PetriNetException {

    private final int weight;

    public InvalidWeightException(int weight) {
        super("Arc weight must be a positive integer, got " + weight);
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}

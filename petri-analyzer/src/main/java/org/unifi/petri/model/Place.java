package org.unifi.petri.model;

import org.unifi.petri.exceptions.InvalidMarkingException;

public class Place {

    private final String name;
    private int tokens;

    Place(String name, int tokens) {
        if (tokens < 0) {
            throw new InvalidMarkingException(name, tokens);
        }
        this.name = name;
        this.tokens = tokens;
    }

    public String getName() {
        return name;
    }

    public int getTokens() {
        return tokens;
    }

    void setTokens(int tokens) {
        if (tokens < 0) {
            throw new InvalidMarkingException(name, tokens);
        }
        this.tokens = tokens;
    }

    @Override
    public String toString() {
        return "Place(" + name + ", tokens=" + tokens + ")";
    }
}

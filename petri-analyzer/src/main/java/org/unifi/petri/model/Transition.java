package org.unifi.petri.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.unifi.petri.exceptions.InvalidWeightException;

/**
 * A firing rule. Input and output weights are keyed by place name, in the order the arcs were added.
 */
public class Transition {

    private final String name;
    private final Map<String, Integer> inputArcs = new LinkedHashMap<>();
    private final Map<String, Integer> outputArcs = new LinkedHashMap<>();

    Transition(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    void addInputArc(Place place, int weight) {
        checkWeight(weight);
        inputArcs.put(place.getName(), weight);
    }

    void addOutputArc(Place place, int weight) {
        checkWeight(weight);
        outputArcs.put(place.getName(), weight);
    }

    public Map<String, Integer> getInputArcs() {
        return Collections.unmodifiableMap(inputArcs);
    }

    public Map<String, Integer> getOutputArcs() {
        return Collections.unmodifiableMap(outputArcs);
    }

    /**
     * Weight-aware enabling: every input place holds at least the arc weight.
     * A transition without inputs is always enabled. Places missing from the marking hold 0 tokens.
     */
    public boolean isEnabled(Map<String, Integer> marking) {
        for (Map.Entry<String, Integer> input : inputArcs.entrySet()) {
            if (marking.getOrDefault(input.getKey(), 0) < input.getValue()) {
                return false;
            }
        }
        return true;
    }

    private static void checkWeight(int weight) {
        if (weight <= 0) {
            throw new InvalidWeightException(weight);
        }
    }

    @Override
    public String toString() {
        return "Transition(" + name + ", in=" + inputArcs + ", out=" + outputArcs + ")";
    }
}

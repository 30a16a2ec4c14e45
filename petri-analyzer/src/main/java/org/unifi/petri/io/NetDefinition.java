package org.unifi.petri.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.unifi.petri.exceptions.UnknownNodeException;
import org.unifi.petri.model.Arc;
import org.unifi.petri.model.PetriNet;
import org.unifi.petri.model.Place;
import org.unifi.petri.model.Transition;

/**
 * The four construction inputs of a net (places, transitions, arcs, marking) before any net is built.
 */
public class NetDefinition {

    private final List<String> places;
    private final List<String> transitions;
    private final List<Arc> arcs;
    private final Map<String, Integer> marking;

    public NetDefinition(List<String> places, List<String> transitions, List<Arc> arcs, Map<String, Integer> marking) {
        this.places = List.copyOf(places);
        this.transitions = List.copyOf(transitions);
        this.arcs = List.copyOf(arcs);
        this.marking = Collections.unmodifiableMap(new LinkedHashMap<>(marking));
    }

    public static NetDefinition of(PetriNet net) {
        List<String> places = new ArrayList<>();
        for (Place p : net.getPlaces()) {
            places.add(p.getName());
        }
        List<String> transitions = new ArrayList<>();
        for (Transition t : net.getTransitions()) {
            transitions.add(t.getName());
        }
        return new NetDefinition(places, transitions, net.getArcs(), net.getMarking());
    }

    /**
     * Builds a fresh net: places with their marked tokens, then transitions, then arcs.
     *
     * @throws UnknownNodeException if the marking names a place that is not declared
     */
    public PetriNet toPetriNet() {
        for (String name : marking.keySet()) {
            if (!places.contains(name)) {
                throw new UnknownNodeException(name);
            }
        }
        PetriNet net = new PetriNet();
        for (String place : places) {
            net.addPlace(place, marking.getOrDefault(place, 0));
        }
        for (String transition : transitions) {
            net.addTransition(transition);
        }
        for (Arc arc : arcs) {
            net.addArc(arc.getSource(), arc.getTarget(), arc.getWeight());
        }
        return net;
    }

    public String formatPlaces() {
        return String.join(", ", places);
    }

    public String formatTransitions() {
        return String.join(", ", transitions);
    }

    public String formatArcs() {
        return arcs.stream().map(a -> a.getSource() + "->" + a.getTarget()).collect(Collectors.joining(", "));
    }

    public String formatMarking() {
        return marking.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", "));
    }

    public List<String> getPlaces() {
        return places;
    }

    public List<String> getTransitions() {
        return transitions;
    }

    public List<Arc> getArcs() {
        return arcs;
    }

    public Map<String, Integer> getMarking() {
        return marking;
    }
}

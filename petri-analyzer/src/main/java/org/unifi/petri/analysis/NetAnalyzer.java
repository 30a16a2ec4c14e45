package org.unifi.petri.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unifi.petri.exceptions.DuplicateNameException;
import org.unifi.petri.exceptions.InvalidMarkingException;
import org.unifi.petri.exceptions.UnknownNodeException;
import org.unifi.petri.exceptions.UnknownPlaceException;
import org.unifi.petri.io.NetDefinition;
import org.unifi.petri.model.Arc;
import org.unifi.petri.model.PetriNet;
import org.unifi.petri.model.Place;
import org.unifi.petri.model.Transition;

/**
 * Structural heuristics over a loaded snapshot of a net. Arc weights are ignored here: a transition
 * counts as enabled when it has input places and each of them holds at least one token. This is
 * deliberately different from {@link Transition#isEnabled(Map)}.
 */
public class NetAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(NetAnalyzer.class);

    private Set<String> places = Collections.emptySet();
    private Set<String> transitions = Collections.emptySet();
    private List<Arc> arcs = Collections.emptyList();
    private Map<String, Integer> marking = Collections.emptyMap();

    public static NetAnalyzer of(PetriNet net) {
        NetAnalyzer analyzer = new NetAnalyzer();
        List<String> placeNames = new ArrayList<>();
        for (Place p : net.getPlaces()) {
            placeNames.add(p.getName());
        }
        List<String> transitionNames = new ArrayList<>();
        for (Transition t : net.getTransitions()) {
            transitionNames.add(t.getName());
        }
        analyzer.load(placeNames, transitionNames, net.getArcs(), net.getMarking());
        return analyzer;
    }

    public void load(NetDefinition definition) {
        load(definition.getPlaces(), definition.getTransitions(), definition.getArcs(), definition.getMarking());
    }

    /**
     * Replaces the analyzed network. Everything is validated before any state changes, so a failed
     * load leaves the previous network in place.
     *
     * @throws DuplicateNameException if a name is declared both as a place and a transition
     * @throws UnknownNodeException if an arc endpoint is not declared
     * @throws UnknownPlaceException if the marking names an undeclared place
     * @throws InvalidMarkingException if a marking value is null
     */
    public void load(Collection<String> places, Collection<String> transitions, Collection<Arc> arcs,
            Map<String, Integer> marking) {
        Set<String> newPlaces = new LinkedHashSet<>(places);
        Set<String> newTransitions = new LinkedHashSet<>(transitions);
        for (String t : newTransitions) {
            if (newPlaces.contains(t)) {
                throw new DuplicateNameException(t);
            }
        }
        for (Arc arc : arcs) {
            if (!newPlaces.contains(arc.getSource()) && !newTransitions.contains(arc.getSource())) {
                throw new UnknownNodeException(arc.getSource());
            }
            if (!newPlaces.contains(arc.getTarget()) && !newTransitions.contains(arc.getTarget())) {
                throw new UnknownNodeException(arc.getTarget());
            }
        }
        for (Map.Entry<String, Integer> entry : marking.entrySet()) {
            if (!newPlaces.contains(entry.getKey())) {
                throw new UnknownPlaceException(entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new InvalidMarkingException("No token count given for place " + entry.getKey());
            }
        }

        this.places = Collections.unmodifiableSet(newPlaces);
        this.transitions = Collections.unmodifiableSet(newTransitions);
        this.arcs = List.copyOf(arcs);
        this.marking = Collections.unmodifiableMap(new LinkedHashMap<>(marking));
        LOG.debug("Loaded {} places, {} transitions, {} arcs", newPlaces.size(), newTransitions.size(), this.arcs.size());
    }

    /**
     * True iff no marking value is negative. A check on the loaded marking, not a reachability
     * argument.
     */
    public boolean analyzeBoundedness() {
        return marking.values().stream().allMatch(tokens -> tokens >= 0);
    }

    /**
     * Fraction of transitions that have at least one input place, at least one output place, and a
     * token in every input place. 0.0 when there are no transitions.
     */
    public double analyzeLiveness() {
        if (transitions.isEmpty()) {
            return 0.0;
        }
        int live = 0;
        for (String t : transitions) {
            if (!outputsOf(t).isEmpty() && allMarked(inputsOf(t))) {
                live++;
            }
        }
        return (double) live / transitions.size();
    }

    /**
     * Transitions with a non-empty input set whose inputs all hold at least one token, sorted by name.
     */
    public List<String> getEnabledTransitions() {
        Set<String> enabled = new TreeSet<>();
        for (String t : transitions) {
            if (allMarked(inputsOf(t))) {
                enabled.add(t);
            }
        }
        return new ArrayList<>(enabled);
    }

    public Set<String> getPlaces() {
        return places;
    }

    public Set<String> getTransitions() {
        return transitions;
    }

    public Map<String, Integer> getMarking() {
        return marking;
    }

    Set<String> inputsOf(String transition) {
        Set<String> inputs = new LinkedHashSet<>();
        for (Arc arc : arcs) {
            if (arc.getTarget().equals(transition)) {
                inputs.add(arc.getSource());
            }
        }
        return inputs;
    }

    Set<String> outputsOf(String transition) {
        Set<String> outputs = new LinkedHashSet<>();
        for (Arc arc : arcs) {
            if (arc.getSource().equals(transition)) {
                outputs.add(arc.getTarget());
            }
        }
        return outputs;
    }

    // an empty input set never counts
    private boolean allMarked(Set<String> inputs) {
        if (inputs.isEmpty()) {
            return false;
        }
        for (String p : inputs) {
            if (marking.getOrDefault(p, 0) <= 0) {
                return false;
            }
        }
        return true;
    }
}

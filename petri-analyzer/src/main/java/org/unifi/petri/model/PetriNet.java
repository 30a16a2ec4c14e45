package org.unifi.petri.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unifi.petri.exceptions.DuplicateNameException;
import org.unifi.petri.exceptions.InvalidArcException;
import org.unifi.petri.exceptions.InvalidMarkingException;
import org.unifi.petri.exceptions.InvalidNameException;
import org.unifi.petri.exceptions.InvalidWeightException;
import org.unifi.petri.exceptions.TransitionNotEnabledException;
import org.unifi.petri.exceptions.UnknownNodeException;

/**
 * A place/transition net built incrementally through {@link #addPlace}, {@link #addTransition} and
 * {@link #addArc}. Places and transitions share one namespace. Arcs are kept in insertion order and
 * are also folded into the weight maps of the transition they touch.
 *
 * <p>Not thread-safe; see {@link org.unifi.petri.api.NetWorkspace} for sharing a net between threads.
 */
public class PetriNet {

    private static final Logger LOG = LoggerFactory.getLogger(PetriNet.class);

    private final Map<String, Place> places = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final List<Arc> arcs = new ArrayList<>();
    private final Map<String, Position> positions = new HashMap<>();
    private final Random layout;

    public PetriNet() {
        this(new Random());
    }

    /**
     * @param layout source of the initial node coordinates
     */
    public PetriNet(Random layout) {
        this.layout = layout;
    }

    public Place addPlace(String name) {
        return addPlace(name, 0);
    }

    public Place addPlace(String name, int tokens) {
        checkNewName(name);
        Place place = new Place(name, tokens);
        places.put(name, place);
        positions.put(name, randomPosition());
        LOG.debug("Added place {} with {} tokens", name, tokens);
        return place;
    }

    public Transition addTransition(String name) {
        checkNewName(name);
        Transition transition = new Transition(name);
        transitions.put(name, transition);
        positions.put(name, randomPosition());
        LOG.debug("Added transition {}", name);
        return transition;
    }

    public Arc addArc(String source, String target) {
        return addArc(source, target, 1);
    }

    /**
     * Adds a weighted arc whose direction is inferred from the endpoints: place to transition is an
     * input arc of the transition, transition to place an output arc. Nothing is recorded when the
     * arc is rejected.
     *
     * @throws InvalidWeightException if {@code weight <= 0}
     * @throws UnknownNodeException if an endpoint is neither a place nor a transition
     * @throws InvalidArcException if both endpoints are places or both are transitions
     */
    public Arc addArc(String source, String target, int weight) {
        if (weight <= 0) {
            throw new InvalidWeightException(weight);
        }
        if (direction(source, target) == ArcDirection.INPUT) {
            transitions.get(target).addInputArc(places.get(source), weight);
        } else {
            transitions.get(source).addOutputArc(places.get(target), weight);
        }

        Arc arc = new Arc(source, target, weight);
        arcs.add(arc);
        LOG.debug("Added arc {}", arc);
        return arc;
    }

    /**
     * Explicit marking assignment for one place.
     */
    public void setTokens(String place, int tokens) {
        requirePlace(place).setTokens(tokens);
    }

    /**
     * @throws UnknownNodeException if an endpoint of the arc is not part of this net
     * @throws InvalidArcException if the arc does not join a place and a transition
     */
    public ArcDirection directionOf(Arc arc) {
        return direction(arc.getSource(), arc.getTarget());
    }

    /**
     * Weight-aware enabling of one transition in the current marking.
     */
    public boolean isEnabled(String transition) {
        return requireTransition(transition).isEnabled(getMarking());
    }

    /**
     * Fires a transition: input weights are consumed, then output weights produced.
     *
     * @return the marking after firing
     * @throws TransitionNotEnabledException if the transition is not enabled; the marking is unchanged
     * @throws InvalidMarkingException if an output place would overflow; the marking is unchanged
     */
    public Map<String, Integer> fire(String transition) {
        Transition t = requireTransition(transition);
        if (!t.isEnabled(getMarking())) {
            throw new TransitionNotEnabledException(transition);
        }
        Map<String, Integer> next = new LinkedHashMap<>(getMarking());
        for (Map.Entry<String, Integer> input : t.getInputArcs().entrySet()) {
            next.merge(input.getKey(), -input.getValue(), Integer::sum);
        }
        for (Map.Entry<String, Integer> output : t.getOutputArcs().entrySet()) {
            try {
                next.put(output.getKey(), Math.addExact(next.get(output.getKey()), output.getValue()));
            } catch (ArithmeticException e) {
                throw new InvalidMarkingException(
                        "Firing " + transition + " would overflow the token count of place " + output.getKey(), e);
            }
        }
        // nothing is touched until every new count is known
        for (Map.Entry<String, Integer> entry : next.entrySet()) {
            places.get(entry.getKey()).setTokens(entry.getValue());
        }
        LOG.debug("Fired {}", transition);
        return getMarking();
    }

    public boolean isBounded() {
        return places.values().stream().allMatch(p -> p.getTokens() >= 0);
    }

    /**
     * True if at least one transition is enabled now. A witness of activity, not a proof of liveness.
     */
    public boolean hasLiveTransitions() {
        Map<String, Integer> marking = getMarking();
        return transitions.values().stream().anyMatch(t -> t.isEnabled(marking));
    }

    /**
     * Snapshot of the token count of every place, in place insertion order.
     */
    public Map<String, Integer> getMarking() {
        Map<String, Integer> marking = new LinkedHashMap<>();
        for (Place place : places.values()) {
            marking.put(place.getName(), place.getTokens());
        }
        return Collections.unmodifiableMap(marking);
    }

    public Position getPosition(String name) {
        if (!contains(name)) {
            throw new UnknownNodeException(name);
        }
        return positions.get(name);
    }

    public void setPosition(String name, double x, double y) {
        if (!contains(name)) {
            throw new UnknownNodeException(name);
        }
        positions.put(name, new Position(x, y));
    }

    public boolean contains(String name) {
        return places.containsKey(name) || transitions.containsKey(name);
    }

    public boolean isEmpty() {
        return places.isEmpty() && transitions.isEmpty();
    }

    public Place getPlace(String name) {
        return requirePlace(name);
    }

    public Transition getTransition(String name) {
        return requireTransition(name);
    }

    public Collection<Place> getPlaces() {
        return Collections.unmodifiableCollection(places.values());
    }

    public Collection<Transition> getTransitions() {
        return Collections.unmodifiableCollection(transitions.values());
    }

    public List<Arc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    private ArcDirection direction(String source, String target) {
        if (!contains(source)) {
            throw new UnknownNodeException(source);
        }
        if (!contains(target)) {
            throw new UnknownNodeException(target);
        }
        if (places.containsKey(source) && transitions.containsKey(target)) {
            return ArcDirection.INPUT;
        }
        if (transitions.containsKey(source) && places.containsKey(target)) {
            return ArcDirection.OUTPUT;
        }
        throw new InvalidArcException(source, target);
    }

    private Place requirePlace(String name) {
        Place place = places.get(name);
        if (place == null) {
            throw new UnknownNodeException(name);
        }
        return place;
    }

    private Transition requireTransition(String name) {
        Transition transition = transitions.get(name);
        if (transition == null) {
            throw new UnknownNodeException(name);
        }
        return transition;
    }

    private void checkNewName(String name) {
        if (name == null || name.isBlank() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidNameException(name);
        }
        if (contains(name)) {
            throw new DuplicateNameException(name);
        }
    }

    private Position randomPosition() {
        return new Position(layout.nextDouble() * 2 - 1, layout.nextDouble() * 2 - 1);
    }

    @Override
    public String toString() {
        return "PetriNet(places=" + places.values() + ", transitions=" + transitions.keySet() + ", arcs=" + arcs + ")";
    }
}

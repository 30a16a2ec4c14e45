package org.unifi.petri.oris;

import java.util.Map;

import org.oristool.petrinet.Marking;
import org.oristool.petrinet.PetriNet;
import org.oristool.petrinet.Place;
import org.oristool.petrinet.Transition;
import org.unifi.petri.exceptions.UnknownNodeException;

/**
 * The same net expressed with the Sirio model, ready to be handed to the ORIS analysis engines.
 * Each input weight becomes a precondition multiplicity and each output weight a postcondition
 * multiplicity; the current tokens become the initial marking.
 */
public class OrisModel {

    private final PetriNet pn;
    private final Marking m;

    private OrisModel(PetriNet pn, Marking m) {
        this.pn = pn;
        this.m = m;
    }

    public static OrisModel from(org.unifi.petri.model.PetriNet net) {
        PetriNet pn = new PetriNet();
        Marking m = new Marking();

        for (org.unifi.petri.model.Place place : net.getPlaces()) {
            Place p = pn.addPlace(place.getName());
            m.setTokens(p, place.getTokens());
        }
        for (org.unifi.petri.model.Transition transition : net.getTransitions()) {
            Transition t = pn.addTransition(transition.getName());
            for (Map.Entry<String, Integer> input : transition.getInputArcs().entrySet()) {
                pn.addPrecondition(pn.getPlace(input.getKey()), t, input.getValue());
            }
            for (Map.Entry<String, Integer> output : transition.getOutputArcs().entrySet()) {
                pn.addPostcondition(t, pn.getPlace(output.getKey()), output.getValue());
            }
        }
        return new OrisModel(pn, m);
    }

    public boolean isEnabled(String transition) {
        Transition t = pn.getTransition(transition);
        if (t == null) {
            throw new UnknownNodeException(transition);
        }
        return pn.isEnabled(t, m);
    }

    public int getTokens(String place) {
        Place p = pn.getPlace(place);
        if (p == null) {
            throw new UnknownNodeException(place);
        }
        return m.getTokens(p);
    }

    public PetriNet getPetriNet() {
        return pn;
    }

    public Marking getMarking() {
        return m;
    }
}

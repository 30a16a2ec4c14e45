package org.unifi.petri.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.unifi.petri.model.Arc;
import org.unifi.petri.model.PetriNet;
import org.unifi.petri.model.Place;
import org.unifi.petri.model.Transition;

/**
 * Writes a net in the format read by {@link NetFileReader}: places, then transitions, then arcs in
 * net order with explicit weights.
 */
public class NetFileWriter {

    static final String PLACE = "PLACE";
    static final String TRANSITION = "TRANSITION";
    static final String ARC = "ARC";

    public void write(PetriNet net, Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(net, writer);
        }
    }

    public String format(PetriNet net) {
        StringWriter out = new StringWriter();
        try {
            write(net, out);
        } catch (IOException e) {
            throw new IllegalStateException("Writing to a string cannot fail", e);
        }
        return out.toString();
    }

    public void write(PetriNet net, Writer out) throws IOException {
        for (Place place : net.getPlaces()) {
            out.write(PLACE + " " + place.getName() + " tokens " + place.getTokens() + "\n");
        }
        for (Transition transition : net.getTransitions()) {
            out.write(TRANSITION + " " + transition.getName() + "\n");
        }
        for (Arc arc : net.getArcs()) {
            out.write(ARC + " " + arc.getSource() + " " + arc.getTarget() + " " + arc.getWeight() + "\n");
        }
        out.flush();
    }
}

package org.unifi.petri.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unifi.petri.exceptions.NetParseException;
import org.unifi.petri.model.PetriNet;

/**
 * Reads the line oriented net format, one whitespace separated record per line:
 * <pre>
 * PLACE p1 tokens 2
 * TRANSITION t1
 * ARC p1 t1 1
 * </pre>
 * The token count of a place is the fourth field and defaults to 0; the arc weight defaults to 1.
 * Blank lines and lines with an unknown keyword are skipped.
 */
public class NetFileReader {

    private static final Logger LOG = LoggerFactory.getLogger(NetFileReader.class);

    public PetriNet read(Path file) throws IOException {
        LOG.info("Loading net from {}", file);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public PetriNet parse(String text) {
        try {
            return read(new StringReader(text));
        } catch (IOException e) {
            throw new IllegalStateException("Reading from a string cannot fail", e);
        }
    }

    public PetriNet read(Reader in) throws IOException {
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        PetriNet net = new PetriNet();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String[] parts = line.trim().split("\\s+");
            if (parts[0].isEmpty()) {
                continue;
            }
            switch (parts[0]) {
                case NetFileWriter.PLACE:
                    require(parts, 2, lineNumber, "PLACE needs a name");
                    net.addPlace(parts[1], parts.length > 3 ? parseInt(parts[3], lineNumber) : 0);
                    break;
                case NetFileWriter.TRANSITION:
                    require(parts, 2, lineNumber, "TRANSITION needs a name");
                    net.addTransition(parts[1]);
                    break;
                case NetFileWriter.ARC:
                    require(parts, 3, lineNumber, "ARC needs a source and a target");
                    net.addArc(parts[1], parts[2], parts.length > 3 ? parseInt(parts[3], lineNumber) : 1);
                    break;
                default:
                    LOG.debug("Skipping line {}: unknown record {}", lineNumber, parts[0]);
            }
        }
        LOG.info("Loaded {} places, {} transitions, {} arcs", net.getPlaces().size(), net.getTransitions().size(),
                net.getArcs().size());
        return net;
    }

    private static void require(String[] parts, int fields, int lineNumber, String message) {
        if (parts.length < fields) {
            throw new NetParseException(lineNumber, message, null);
        }
    }

    private static int parseInt(String value, int lineNumber) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new NetParseException(lineNumber, "not an integer: " + value, e);
        }
    }
}

package org.unifi.petri.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.unifi.petri.exceptions.NetParseException;
import org.unifi.petri.model.Arc;

/**
 * Parses the comma separated construction inputs:
 * <pre>
 * places       p1, p2, p3
 * transitions  t1, t2
 * arcs         p1-&gt;t1, t1-&gt;p2
 * marking      p1=1, p2=0
 * </pre>
 * Items are trimmed and empty items skipped. Arcs always get weight 1.
 */
public class ConstructionInputParser {

    private static final String ARROW = "->";

    /**
     * @throws NetParseException if an item is malformed, or if no place, no transition or no arc is given
     */
    public NetDefinition parse(String places, String transitions, String arcs, String marking) {
        List<String> placeNames = parseNames(places);
        if (placeNames.isEmpty()) {
            throw new NetParseException("At least one place must be defined");
        }
        List<String> transitionNames = parseNames(transitions);
        if (transitionNames.isEmpty()) {
            throw new NetParseException("At least one transition must be defined");
        }
        List<Arc> arcList = parseArcs(arcs);
        if (arcList.isEmpty()) {
            throw new NetParseException("At least one arc must be defined");
        }
        return new NetDefinition(placeNames, transitionNames, arcList, parseMarking(marking));
    }

    public List<String> parseNames(String input) {
        List<String> names = new ArrayList<>();
        for (String item : split(input)) {
            if (item.chars().anyMatch(Character::isWhitespace)) {
                throw new NetParseException("Name contains whitespace: '" + item + "'");
            }
            names.add(item);
        }
        return names;
    }

    public List<Arc> parseArcs(String input) {
        List<Arc> arcs = new ArrayList<>();
        for (String item : split(input)) {
            int arrow = item.indexOf(ARROW);
            if (arrow < 0 || item.indexOf(ARROW, arrow + ARROW.length()) >= 0) {
                throw new NetParseException("Arc must have the form source->target: '" + item + "'");
            }
            String source = item.substring(0, arrow).trim();
            String target = item.substring(arrow + ARROW.length()).trim();
            if (source.isEmpty() || target.isEmpty()) {
                throw new NetParseException("Arc is missing an endpoint: '" + item + "'");
            }
            arcs.add(new Arc(source, target));
        }
        return arcs;
    }

    public Map<String, Integer> parseMarking(String input) {
        Map<String, Integer> marking = new LinkedHashMap<>();
        for (String item : split(input)) {
            String[] parts = item.split("=", -1);
            if (parts.length != 2 || parts[0].trim().isEmpty()) {
                throw new NetParseException("Marking must have the form place=tokens: '" + item + "'");
            }
            marking.put(parts[0].trim(), parseCount(parts[1].trim(), item));
        }
        return marking;
    }

    private static int parseCount(String value, String item) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new NetParseException("Token count is not an integer: '" + item + "'", e);
        }
    }

    private static List<String> split(String input) {
        List<String> items = new ArrayList<>();
        if (input == null) {
            return items;
        }
        for (String item : input.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }
}

package org.unifi.petri.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.unifi.petri.model.PetriNet;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Every analysis result for one net: the net's own checks and the structural heuristics of
 * {@link NetAnalyzer}.
 */
@JsonPropertyOrder({"bounded", "liveTransitions", "structuralBoundedness", "structuralLiveness", "enabledTransitions", "places"})
public class AnalysisReport {

    private static final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final boolean bounded;
    private final boolean liveTransitions;
    private final boolean structuralBoundedness;
    private final double structuralLiveness;
    private final List<String> enabledTransitions;
    private final Map<String, Integer> places;

    private AnalysisReport(PetriNet net, NetAnalyzer analyzer) {
        this.bounded = net.isBounded();
        this.liveTransitions = net.hasLiveTransitions();
        this.structuralBoundedness = analyzer.analyzeBoundedness();
        this.structuralLiveness = analyzer.analyzeLiveness();
        this.enabledTransitions = List.copyOf(analyzer.getEnabledTransitions());
        this.places = Collections.unmodifiableMap(new LinkedHashMap<>(net.getMarking()));
    }

    public static AnalysisReport of(PetriNet net) {
        return new AnalysisReport(net, NetAnalyzer.of(net));
    }

    public boolean isBounded() {
        return bounded;
    }

    public boolean isLiveTransitions() {
        return liveTransitions;
    }

    public boolean isStructuralBoundedness() {
        return structuralBoundedness;
    }

    public double getStructuralLiveness() {
        return structuralLiveness;
    }

    public List<String> getEnabledTransitions() {
        return enabledTransitions;
    }

    public Map<String, Integer> getPlaces() {
        return places;
    }

    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Bounded: ").append(yesNo(bounded)).append('\n');
        sb.append("Live Transitions: ").append(yesNo(liveTransitions)).append('\n');
        sb.append("Structural Boundedness: ").append(yesNo(structuralBoundedness)).append('\n');
        sb.append("Structural Liveness: ").append(percent(structuralLiveness)).append("%\n");
        sb.append("Enabled Transitions:\n");
        if (enabledTransitions.isEmpty()) {
            sb.append("  No Enabled Transitions\n");
        }
        for (String t : enabledTransitions) {
            sb.append("  ").append(t).append('\n');
        }
        sb.append("\nPlaces Status:\n");
        places.forEach((name, tokens) -> sb.append("  ").append(name).append(": ").append(tokens).append(" tokens\n"));
        return sb.toString();
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize analysis report", e);
        }
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }

    // half to even, so 1/8 prints as 12%
    private static BigDecimal percent(double fraction) {
        return BigDecimal.valueOf(fraction).movePointRight(2).setScale(0, RoundingMode.HALF_EVEN);
    }
}

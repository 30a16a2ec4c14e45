package org.unifi.petri;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.unifi.petri.analysis.NetAnalyzer;
import org.unifi.petri.exceptions.InvalidArcException;
import org.unifi.petri.exceptions.NetParseException;
import org.unifi.petri.exceptions.UnknownNodeException;
import org.unifi.petri.io.ConstructionInputParser;
import org.unifi.petri.io.NetDefinition;
import org.unifi.petri.model.Arc;
import org.unifi.petri.model.PetriNet;

public class ConstructionInputParserTest {

    private final ConstructionInputParser parser = new ConstructionInputParser();

    @Test
    public void testParseFormExample() {
        NetDefinition definition = parser.parse("p1, p2, p3", "t1, t2", "p1->t1, t1->p2, p2->t2", "p1=1, p2=0, p3=2");

        assertEquals(List.of("p1", "p2", "p3"), definition.getPlaces());
        assertEquals(List.of("t1", "t2"), definition.getTransitions());
        assertEquals(List.of(new Arc("p1", "t1"), new Arc("t1", "p2"), new Arc("p2", "t2")), definition.getArcs());
        assertEquals(Map.of("p1", 1, "p2", 0, "p3", 2), definition.getMarking());

        NetAnalyzer analyzer = new NetAnalyzer();
        analyzer.load(definition);
        assertEquals(List.of("t1"), analyzer.getEnabledTransitions());
        assertEquals(0.5, analyzer.analyzeLiveness(), 0.0);
    }

    @Test
    public void testWhitespaceAndEmptyItems() {
        assertEquals(List.of("a", "b"), parser.parseNames("  a ,, b ,  "));
        assertEquals(List.of(new Arc("a", "t")), parser.parseArcs(" a -> t ,"));
        assertTrue(parser.parseMarking("").isEmpty());
        assertTrue(parser.parseNames(null).isEmpty());
    }

    @Test
    public void testMalformedInput() {
        assertThrows(NetParseException.class, () -> parser.parseArcs("p1-t1"), "Arc without arrow");
        assertThrows(NetParseException.class, () -> parser.parseArcs("p1->t1->p2"), "Arc with two arrows");
        assertThrows(NetParseException.class, () -> parser.parseArcs("->t1"), "Arc without source");
        assertThrows(NetParseException.class, () -> parser.parseMarking("p1"), "Marking without =");
        assertThrows(NetParseException.class, () -> parser.parseMarking("p1=x"), "Non integer count");
        assertThrows(NetParseException.class, () -> parser.parseMarking("p1=1=2"));
        assertThrows(NetParseException.class, () -> parser.parseNames("p 1"));
    }

    @Test
    public void testToPetriNet() {
        PetriNet net = parser.parse("p1, p2", "t1", "p1->t1, t1->p2", "p1=3").toPetriNet();

        assertEquals(3, net.getPlace("p1").getTokens());
        assertEquals(0, net.getPlace("p2").getTokens());
        assertTrue(net.isEnabled("t1"));

        assertThrows(UnknownNodeException.class, () -> parser.parse("p1", "t1", "p1->t1", "p9=1").toPetriNet());
        assertThrows(InvalidArcException.class, () -> parser.parse("p1, p2", "t1", "p1->p2", "").toPetriNet());
    }

    @Test
    public void testFormatBack() {
        NetDefinition definition = NetDefinition.of(parser.parse("p1,p2", "t1", "p1->t1,t1->p2", "p1=1").toPetriNet());

        assertEquals("p1, p2", definition.formatPlaces());
        assertEquals("t1", definition.formatTransitions());
        assertEquals("p1->t1, t1->p2", definition.formatArcs());
        assertEquals("p1=1, p2=0", definition.formatMarking());
    }

    @Test
    public void testEmptyInputsRejected() {
        NetParseException noPlace = assertThrows(NetParseException.class, () -> parser.parse(" , ", "t1", "t1->p1", ""));
        assertEquals("At least one place must be defined", noPlace.getMessage());
        NetParseException noTransition = assertThrows(NetParseException.class, () -> parser.parse("p1", "", "p1->t1", ""));
        assertEquals("At least one transition must be defined", noTransition.getMessage());
        NetParseException noArc = assertThrows(NetParseException.class, () -> parser.parse("p1", "t1", null, "p1=1"));
        assertEquals("At least one arc must be defined", noArc.getMessage());
    }
}

package org.unifi.petri;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.unifi.petri.api.NetWorkspace;
import org.unifi.petri.exceptions.DuplicateNameException;
import org.unifi.petri.model.PetriNet;

public class NetWorkspaceTest {

    @Test
    public void testResetGivesEmptyNet() {
        NetWorkspace workspace = new NetWorkspace();
        workspace.update(net -> {
            net.addPlace("p1", 1);
            net.addTransition("t1");
            net.addArc("p1", "t1");
        });
        boolean emptyBefore = workspace.read(PetriNet::isEmpty);
        assertFalse(emptyBefore);

        workspace.reset();

        boolean emptyAfter = workspace.read(PetriNet::isEmpty);
        assertTrue(emptyAfter, "Reset must discard the previous net");
        workspace.update(net -> net.addPlace("p1"));
        int tokens = workspace.read(net -> net.getPlace("p1").getTokens());
        assertEquals(0, tokens);
    }

    @Test
    public void testReplace() {
        PetriNet loaded = new PetriNet();
        loaded.addPlace("x", 7);
        NetWorkspace workspace = new NetWorkspace();

        workspace.replace(loaded);

        int tokens = workspace.read(net -> net.getPlace("x").getTokens());
        assertEquals(7, tokens);
    }

    @Test
    public void testErrorsReachTheCaller() {
        NetWorkspace workspace = new NetWorkspace();
        workspace.update(net -> net.addPlace("p1"));
        assertThrows(DuplicateNameException.class, () -> workspace.update(net -> net.addTransition("p1")));
        int places = workspace.read(net -> net.getPlaces().size());
        assertEquals(1, places);
    }

    @Test
    public void testConcurrentFiringIsSerialized() throws Exception {
        NetWorkspace workspace = new NetWorkspace();
        workspace.update(net -> {
            net.addPlace("in", 1000);
            net.addPlace("out");
            net.addTransition("move");
            net.addArc("in", "move");
            net.addArc("move", "out");
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(pool.submit(() -> {
                for (int j = 0; j < 250; j++) {
                    workspace.update(net -> net.fire("move"));
                    workspace.read(PetriNet::isBounded);
                }
            }));
        }
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        int in = workspace.read(net -> net.getPlace("in").getTokens());
        int out = workspace.read(net -> net.getPlace("out").getTokens());
        assertEquals(0, in);
        assertEquals(1000, out, "Lost updates under concurrent firing");
    }
}

package org.unifi.petri.api;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unifi.petri.model.PetriNet;

/**
 * Owns the net a caller is currently working on. Mutations run under an exclusive lock, queries
 * under a shared one. Resetting swaps in a new empty net.
 */
public class NetWorkspace {

    private static final Logger LOG = LoggerFactory.getLogger(NetWorkspace.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private PetriNet net;

    public NetWorkspace() {
        this(new PetriNet());
    }

    public NetWorkspace(PetriNet net) {
        this.net = net;
    }

    public <T> T read(Function<PetriNet, T> query) {
        lock.readLock().lock();
        try {
            return query.apply(net);
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Function<PetriNet, T> mutation) {
        lock.writeLock().lock();
        try {
            return mutation.apply(net);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void update(Consumer<PetriNet> mutation) {
        write(n -> {
            mutation.accept(n);
            return null;
        });
    }

    public void replace(PetriNet replacement) {
        lock.writeLock().lock();
        try {
            net = replacement;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void reset() {
        replace(new PetriNet());
        LOG.info("Workspace reset");
    }
}

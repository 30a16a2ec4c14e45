package org.unifi.petri.model;

import java.util.Objects;

public final class Arc {

    private final String source;
    private final String target;
    private final int weight;

    public Arc(String source, String target, int weight) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.weight = weight;
    }

    public Arc(String source, String target) {
        this(source, target, 1);
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public int getWeight() {
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Arc)) {
            return false;
        }
        Arc other = (Arc) o;
        return weight == other.weight && source.equals(other.source) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, weight);
    }

    @Override
    public String toString() {
        return weight == 1 ? source + "->" + target : source + "->" + target + "(" + weight + ")";
    }
}

package org.unifi.petri.model;

public enum ArcDirection {
    /** place to transition */
    INPUT,
    /** transition to place */
    OUTPUT
}

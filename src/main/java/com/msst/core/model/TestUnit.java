package com.msst.core.model;

/**
 * A discovered, executable compatibility check.
 *
 * @param id       normalized identifier, always exactly three digits (e.g. "016")
 * @param name     display name, {@code test_<id>}
 * @param group    category the unit belongs to
 * @param title    one-line description declared by the unit
 * @param location the compiled class that carries the unit's entry point
 */
public record TestUnit(
    String id,
    String name,
    String group,
    String title,
    Class<?> location
) {
    public int numericId() {
        return Integer.parseInt(id);
    }
}

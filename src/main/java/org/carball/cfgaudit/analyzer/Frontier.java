package org.carball.cfgaudit.analyzer;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Open exits of the graph built so far: the nodes still waiting for a successor.
 * Immutable; iteration is in ascending id order.
 */
public record Frontier(SortedSet<Integer> ids) {

    private static final Frontier EMPTY = new Frontier(new TreeSet<>());

    public Frontier {
        ids = Collections.unmodifiableSortedSet(new TreeSet<>(ids));
    }

    public static Frontier empty() {
        return EMPTY;
    }

    public static Frontier of(int id) {
        TreeSet<Integer> ids = new TreeSet<>();
        ids.add(id);
        return new Frontier(ids);
    }

    public Frontier union(Frontier other) {
        TreeSet<Integer> merged = new TreeSet<>(ids);
        merged.addAll(other.ids);
        return new Frontier(merged);
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public boolean contains(int id) {
        return ids.contains(id);
    }

    public int size() {
        return ids.size();
    }
}

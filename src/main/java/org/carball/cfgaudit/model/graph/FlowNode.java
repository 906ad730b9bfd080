package org.carball.cfgaudit.model.graph;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A completed graph node.
 *
 * @param condition rendered condition, only present on {@link NodeKind#DECISION} nodes
 * @param successors outgoing edges in insertion order
 * @param predecessors ids of nodes with an edge into this one
 */
public record FlowNode(int id,
                       String label,
                       NodeKind kind,
                       String condition,
                       List<FlowEdge> successors,
                       Set<Integer> predecessors) {
    public FlowNode {
        Objects.requireNonNull(kind, "kind");
        label = Optional.ofNullable(label).orElse("");
        successors = List.copyOf(Optional.ofNullable(successors).orElseGet(List::of));
        SortedSet<Integer> sorted = new TreeSet<>(Optional.ofNullable(predecessors).orElseGet(Set::of));
        predecessors = Collections.unmodifiableSortedSet(sorted);
    }

    public int outDegree() {
        return successors.size();
    }
}

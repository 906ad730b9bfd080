package org.carball.cfgaudit.model.graph;

import java.util.Optional;

/**
 * Outgoing edge of a node. An empty label means the edge is unlabeled.
 */
public record FlowEdge(int target, String label) {
    public static final String TRUE = "True";
    public static final String FALSE = "False";

    public FlowEdge {
        label = Optional.ofNullable(label).orElse("");
    }

    public static FlowEdge unlabeled(int target) {
        return new FlowEdge(target, "");
    }

    public boolean isLabeled() {
        return !label.isEmpty();
    }

    public FlowEdge withLabel(String newLabel) {
        return new FlowEdge(target, newLabel);
    }
}

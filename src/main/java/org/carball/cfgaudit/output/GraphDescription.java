package org.carball.cfgaudit.output;

import java.util.List;

/**
 * Renderer-neutral description: nodes by ascending id, edges in each node's insertion order.
 */
public record GraphDescription(List<NodeRecord> nodes, List<EdgeRecord> edges) {
    public GraphDescription {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @param labelLines display label already wrapped to the column width
     */
    public record NodeRecord(int id, List<String> labelLines, String shape, String color) {
        public NodeRecord {
            labelLines = List.copyOf(labelLines);
        }
    }

    /**
     * @param label edge label, null when the edge is unlabeled
     */
    public record EdgeRecord(int source, int target, String label) {
        public boolean hasLabel() {
            return label != null && !label.isEmpty();
        }
    }
}

package org.carball.cfgaudit.model.graph;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only control-flow graph. Nodes are stored by id; ids are dense, so node {@code i} sits at index {@code i}.
 */
public record ControlFlowGraph(List<FlowNode> nodes) {
    public ControlFlowGraph {
        nodes = List.copyOf(nodes);
        for (int i = 0; i < nodes.size(); i++) {
            FlowNode node = nodes.get(i);
            if (node.id() != i) {
                throw new IllegalArgumentException("Node ids must be dense and ascending, found " + node.id() + " at " + i);
            }
            for (FlowEdge edge : node.successors()) {
                if (edge.target() < 0 || edge.target() >= nodes.size()) {
                    throw new IllegalArgumentException("Edge " + i + " -> " + edge.target() + " targets a missing node");
                }
            }
        }
    }

    public static ControlFlowGraph empty() {
        return new ControlFlowGraph(List.of());
    }

    public FlowNode node(int id) {
        return nodes.get(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return nodes.stream().mapToInt(FlowNode::outDegree).sum();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<FlowNode> nodesOfKind(NodeKind kind) {
        return nodes.stream()
                .filter(n -> n.kind() == kind)
                .collect(Collectors.toList());
    }

    /**
     * Node count per kind; kinds that do not occur map to zero.
     */
    public Map<NodeKind, Integer> countsByKind() {
        Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            counts.put(kind, 0);
        }
        nodes.forEach(n -> counts.merge(n.kind(), 1, Integer::sum));
        return counts;
    }
}

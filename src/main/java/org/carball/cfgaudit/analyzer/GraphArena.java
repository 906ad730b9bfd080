package org.carball.cfgaudit.analyzer;

import org.carball.cfgaudit.model.graph.ControlFlowGraph;
import org.carball.cfgaudit.model.graph.FlowEdge;
import org.carball.cfgaudit.model.graph.FlowNode;
import org.carball.cfgaudit.model.graph.NodeKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mutable node table owned by one build session. Nodes are addressed by id; edges hold ids only.
 */
final class GraphArena {

    private final List<ArenaNode> nodes = new ArrayList<>();

    int createNode(String label, NodeKind kind, String condition) {
        int id = nodes.size();
        nodes.add(new ArenaNode(id, label, kind, kind == NodeKind.DECISION ? condition : null));
        return id;
    }

    /**
     * Id the next {@link #createNode} call will hand out.
     */
    int nextId() {
        return nodes.size();
    }

    void addEdge(int from, int to) {
        ArenaNode source = require(from);
        ArenaNode target = require(to);
        source.successors.add(FlowEdge.unlabeled(to));
        target.predecessors.add(from);
    }

    /**
     * Links every open exit to {@code target}. The returned frontier is {@code {target}},
     * even when there was nothing to link (code after a return).
     */
    Frontier connectFrontierTo(Frontier frontier, int target) {
        for (int id : frontier.ids()) {
            addEdge(id, target);
        }
        return Frontier.of(target);
    }

    void relabel(int decisionId, EdgeLabeling labeling) {
        ArenaNode decision = require(decisionId);
        if (decision.kind != NodeKind.DECISION) {
            throw new IllegalStateException("Node " + decisionId + " is not a decision node");
        }
        List<FlowEdge> labeled = labeling.label(decisionId, List.copyOf(decision.successors));
        decision.successors.clear();
        decision.successors.addAll(labeled);
    }

    ControlFlowGraph freeze() {
        return new ControlFlowGraph(nodes.stream()
                .map(ArenaNode::toFlowNode)
                .collect(Collectors.toList()));
    }

    private ArenaNode require(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return nodes.get(id);
    }

    private static final class ArenaNode {
        private final int id;
        private final String label;
        private final NodeKind kind;
        private final String condition;
        private final List<FlowEdge> successors = new ArrayList<>();
        private final Set<Integer> predecessors = new HashSet<>();

        private ArenaNode(int id, String label, NodeKind kind, String condition) {
            this.id = id;
            this.label = label;
            this.kind = kind;
            this.condition = condition;
        }

        private FlowNode toFlowNode() {
            return new FlowNode(id, label, kind, condition, successors, predecessors);
        }
    }
}

package org.carball.cfgaudit.analyzer;

import org.carball.cfgaudit.model.graph.FlowEdge;

import java.util.List;

/**
 * Assigns the "True"/"False" labels to the outgoing edges of a decision node.
 */
interface EdgeLabeling {

    List<FlowEdge> label(int decisionId, List<FlowEdge> successors);

    static void requireTrueFalsePair(int decisionId, List<FlowEdge> labeled) {
        long trueEdges = labeled.stream().filter(e -> FlowEdge.TRUE.equals(e.label())).count();
        long falseEdges = labeled.stream().filter(e -> FlowEdge.FALSE.equals(e.label())).count();
        if (labeled.size() != 2 || trueEdges != 1 || falseEdges != 1) {
            throw new IllegalStateException("Decision node " + decisionId
                    + " must end with one True and one False edge, got " + labeled);
        }
    }
}

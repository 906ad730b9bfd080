package org.carball.cfgaudit.analyzer;

import org.carball.cfgaudit.model.graph.FlowEdge;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Loop rule, independent of insertion order: an edge that stays in the loop (back to the decision
 * itself, or into a node of the loop's own body) is "True", any other edge leaves the loop and is "False".
 * The body is the id range {@code [bodyStart, bodyEnd)} handed out while it was traversed.
 */
final class LoopBodyLabeling implements EdgeLabeling {

    private final int bodyStart;
    private final int bodyEnd;

    LoopBodyLabeling(int bodyStart, int bodyEnd) {
        this.bodyStart = bodyStart;
        this.bodyEnd = bodyEnd;
    }

    @Override
    public List<FlowEdge> label(int decisionId, List<FlowEdge> successors) {
        List<FlowEdge> labeled = successors.stream()
                .map(edge -> edge.withLabel(staysInLoop(decisionId, edge.target()) ? FlowEdge.TRUE : FlowEdge.FALSE))
                .collect(Collectors.toList());
        EdgeLabeling.requireTrueFalsePair(decisionId, labeled);
        return labeled;
    }

    private boolean staysInLoop(int decisionId, int target) {
        return target == decisionId || (target >= bodyStart && target < bodyEnd);
    }
}

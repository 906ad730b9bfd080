package org.carball.cfgaudit.analyzer;

import org.carball.cfgaudit.model.graph.FlowEdge;

import java.util.List;

/**
 * Conditional rule: the true branch is always traversed first, so the first inserted edge is "True"
 * and the second is "False".
 */
final class BranchOrderLabeling implements EdgeLabeling {

    static final BranchOrderLabeling INSTANCE = new BranchOrderLabeling();

    private BranchOrderLabeling() {
    }

    @Override
    public List<FlowEdge> label(int decisionId, List<FlowEdge> successors) {
        if (successors.size() != 2) {
            throw new IllegalStateException("Conditional " + decisionId
                    + " expected two outgoing edges, found " + successors.size());
        }
        List<FlowEdge> labeled = List.of(
                successors.get(0).withLabel(FlowEdge.TRUE),
                successors.get(1).withLabel(FlowEdge.FALSE));
        EdgeLabeling.requireTrueFalsePair(decisionId, labeled);
        return labeled;
    }
}

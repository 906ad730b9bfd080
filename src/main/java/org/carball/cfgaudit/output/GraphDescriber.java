package org.carball.cfgaudit.output;

import org.carball.cfgaudit.model.graph.ControlFlowGraph;
import org.carball.cfgaudit.model.graph.FlowEdge;
import org.carball.cfgaudit.model.graph.FlowNode;

import java.util.ArrayList;
import java.util.List;

public class GraphDescriber {

    private final LabelWrapper labelWrapper;

    public GraphDescriber(LabelWrapper labelWrapper) {
        this.labelWrapper = labelWrapper;
    }

    public GraphDescription describe(ControlFlowGraph graph) {
        List<GraphDescription.NodeRecord> nodes = new ArrayList<>();
        List<GraphDescription.EdgeRecord> edges = new ArrayList<>();

        for (FlowNode node : graph.nodes()) {
            NodeStyle style = NodeStyle.forKind(node.kind());
            nodes.add(new GraphDescription.NodeRecord(node.id(), labelWrapper.wrap(node.label()), style.shape(), style.color()));
        }
        for (FlowNode node : graph.nodes()) {
            for (FlowEdge edge : node.successors()) {
                edges.add(new GraphDescription.EdgeRecord(node.id(), edge.target(), edge.isLabeled() ? edge.label() : null));
            }
        }
        return new GraphDescription(nodes, edges);
    }
}

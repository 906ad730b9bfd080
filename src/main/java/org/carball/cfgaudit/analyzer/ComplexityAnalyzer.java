package org.carball.cfgaudit.analyzer;

import org.carball.cfgaudit.model.analysis.ComplexityReport;
import org.carball.cfgaudit.model.analysis.RiskRating;
import org.carball.cfgaudit.model.graph.ControlFlowGraph;
import org.carball.cfgaudit.model.graph.NodeKind;

/**
 * McCabe-style metrics over a completed graph.
 */
public class ComplexityAnalyzer {

    private static final int MINIMUM_COMPLEXITY = 1;

    /**
     * {@code max(1, E - N + 2P)}. P is 1 for any non-empty graph; connectivity is not verified.
     */
    public int cyclomaticComplexity(ControlFlowGraph graph) {
        int edges = graph.edgeCount();
        int nodes = graph.nodeCount();
        return Math.max(MINIMUM_COMPLEXITY, edges - nodes + 2 * components(graph));
    }

    /**
     * Decision points + 1.
     */
    public int decisionComplexity(ControlFlowGraph graph) {
        return decisionCount(graph) + 1;
    }

    public RiskRating riskRating(int complexity) {
        return RiskRating.fromComplexity(complexity);
    }

    public ComplexityReport analyze(ControlFlowGraph graph) {
        int cyclomatic = cyclomaticComplexity(graph);
        return new ComplexityReport(
                cyclomatic,
                decisionComplexity(graph),
                riskRating(cyclomatic),
                graph.nodeCount(),
                graph.edgeCount(),
                components(graph),
                decisionCount(graph),
                graph.countsByKind()
        );
    }

    public String generateComplexityReport(ComplexityReport report) {
        StringBuilder text = new StringBuilder();

        text.append("Cyclomatic Complexity (M = E - N + 2P): ").append(report.cyclomaticComplexity()).append("\n");
        text.append("  - E (edges): ").append(report.edgeCount()).append("\n");
        text.append("  - N (nodes): ").append(report.nodeCount()).append("\n");
        text.append("  - P (connected components): ").append(report.components()).append("\n");
        text.append("Complexity (decisions + 1): ").append(report.decisionComplexity()).append("\n");
        text.append("Risk level: ").append(report.riskRating().getDisplayName()).append("\n");

        return text.toString();
    }

    private int decisionCount(ControlFlowGraph graph) {
        return graph.nodesOfKind(NodeKind.DECISION).size();
    }

    private int components(ControlFlowGraph graph) {
        return graph.isEmpty() ? 0 : 1;
    }
}

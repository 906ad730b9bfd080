package org.carball.cfgaudit.model.analysis;

import org.carball.cfgaudit.model.graph.NodeKind;

import java.util.Map;

/**
 * Complexity figures for one graph. {@code edgeCount}, {@code nodeCount} and {@code components}
 * are the E, N and P of {@code M = E - N + 2P}.
 */
public record ComplexityReport(
        int cyclomaticComplexity,
        int decisionComplexity,
        RiskRating riskRating,
        int nodeCount,
        int edgeCount,
        int components,
        int decisionCount,
        Map<NodeKind, Integer> countsByKind
) {
    public ComplexityReport {
        countsByKind = Map.copyOf(countsByKind);
    }

    public int count(NodeKind kind) {
        return countsByKind.getOrDefault(kind, 0);
    }

    public int ioOperations() {
        return count(NodeKind.INPUT) + count(NodeKind.OUTPUT);
    }
}

package org.carball.cfgaudit.model.analysis;

import org.carball.cfgaudit.model.graph.ControlFlowGraph;

public record AnalysisResult(
        String sourceName,
        ControlFlowGraph graph,
        ComplexityReport complexity
) {}

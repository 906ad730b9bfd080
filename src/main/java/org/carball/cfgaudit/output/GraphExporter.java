package org.carball.cfgaudit.output;

import org.carball.cfgaudit.model.graph.ControlFlowGraph;

/**
 * Serializes a completed graph into the text grammar of an external layout engine.
 * The same graph always yields byte-identical text; an empty graph yields an empty string.
 */
public interface GraphExporter {
    String id();

    String displayName();

    String export(ControlFlowGraph graph);
}

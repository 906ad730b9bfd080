package org.carball.cfgaudit.output;

import org.carball.cfgaudit.model.graph.NodeKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Shape and fill-color tokens per node kind.
 */
public record NodeStyle(String shape, String color) {

    public static final String ELLIPSE = "ellipse";
    public static final String BOX = "box";
    public static final String DIAMOND = "diamond";
    public static final String PARALLELOGRAM = "parallelogram";

    private static final Map<NodeKind, NodeStyle> STYLES = new EnumMap<>(NodeKind.class);

    static {
        STYLES.put(NodeKind.START, new NodeStyle(ELLIPSE, "lightgreen"));
        STYLES.put(NodeKind.END, new NodeStyle(ELLIPSE, "lightcoral"));
        STYLES.put(NodeKind.PROCESS, new NodeStyle(BOX, "lightyellow"));
        STYLES.put(NodeKind.DECISION, new NodeStyle(DIAMOND, "lightblue"));
        STYLES.put(NodeKind.INPUT, new NodeStyle(PARALLELOGRAM, "lightcyan"));
        STYLES.put(NodeKind.OUTPUT, new NodeStyle(PARALLELOGRAM, "lightgreen"));
        STYLES.put(NodeKind.CALL, new NodeStyle(BOX, "plum"));
    }

    public static NodeStyle forKind(NodeKind kind) {
        return STYLES.getOrDefault(kind, new NodeStyle(BOX, "lightgray"));
    }
}

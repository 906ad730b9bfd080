package org.carball.cfgaudit.output;

import org.carball.cfgaudit.model.graph.ControlFlowGraph;

import java.util.stream.Collectors;

/**
 * Graphviz DOT dialect.
 */
public class DotGraphExporter implements GraphExporter {

    private final GraphDescriber describer;

    public DotGraphExporter(GraphDescriber describer) {
        this.describer = describer;
    }

    @Override
    public String id() {
        return "dot";
    }

    @Override
    public String displayName() {
        return "Graphviz DOT";
    }

    @Override
    public String export(ControlFlowGraph graph) {
        GraphDescription description = describer.describe(graph);
        if (description.isEmpty()) {
            return "";
        }

        StringBuilder builder = new StringBuilder();
        builder.append("// Control Flow Graph\n");
        builder.append("digraph {\n");
        builder.append("\trankdir=TB splines=ortho\n");
        builder.append("\tnode [fontname=Arial fontsize=10]\n");
        builder.append("\tedge [fontname=Arial fontsize=9]\n");
        for (GraphDescription.NodeRecord node : description.nodes()) {
            boolean diamond = NodeStyle.DIAMOND.equals(node.shape());
            builder.append('\t').append(node.id())
                    .append(" [label=\"").append(label(node)).append('"')
                    .append(" shape=").append(node.shape())
                    .append(" fillcolor=").append(node.color())
                    .append(" style=filled")
                    .append(" width=").append(diamond ? "1.5" : "1.0")
                    .append(" height=").append(diamond ? "1.0" : "0.5")
                    .append("]\n");
        }
        for (GraphDescription.EdgeRecord edge : description.edges()) {
            builder.append('\t').append(edge.source()).append(" -> ").append(edge.target());
            if (edge.hasLabel()) {
                builder.append(" [label=\"").append(escape(edge.label())).append("\"]");
            }
            builder.append('\n');
        }
        builder.append("}\n");
        return builder.toString();
    }

    private String label(GraphDescription.NodeRecord node) {
        return node.labelLines().stream()
                .map(DotGraphExporter::escape)
                .collect(Collectors.joining("\\n"));
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\r", "")
                .replace("\n", "\\n");
    }
}

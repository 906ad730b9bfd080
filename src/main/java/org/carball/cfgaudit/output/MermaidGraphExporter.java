package org.carball.cfgaudit.output;

import org.carball.cfgaudit.model.graph.ControlFlowGraph;

import java.util.stream.Collectors;

/**
 * Mermaid flowchart dialect.
 */
public class MermaidGraphExporter implements GraphExporter {

    private final GraphDescriber describer;

    public MermaidGraphExporter(GraphDescriber describer) {
        this.describer = describer;
    }

    @Override
    public String id() {
        return "mermaid";
    }

    @Override
    public String displayName() {
        return "Mermaid Flowchart";
    }

    @Override
    public String export(ControlFlowGraph graph) {
        GraphDescription description = describer.describe(graph);
        if (description.isEmpty()) {
            return "";
        }

        StringBuilder builder = new StringBuilder();
        builder.append("flowchart TB\n");
        for (GraphDescription.NodeRecord node : description.nodes()) {
            builder.append("  ").append(nodeId(node.id())).append(nodeShape(node)).append('\n');
        }
        builder.append('\n');
        for (GraphDescription.EdgeRecord edge : description.edges()) {
            builder.append("  ").append(nodeId(edge.source())).append(" -->");
            if (edge.hasLabel()) {
                builder.append("|\"").append(escape(edge.label())).append("\"|");
            }
            builder.append(' ').append(nodeId(edge.target())).append('\n');
        }
        builder.append('\n');
        for (GraphDescription.NodeRecord node : description.nodes()) {
            builder.append("  style ").append(nodeId(node.id())).append(" fill:").append(node.color()).append('\n');
        }
        return builder.toString();
    }

    private String nodeShape(GraphDescription.NodeRecord node) {
        String label = node.labelLines().stream()
                .map(MermaidGraphExporter::escape)
                .collect(Collectors.joining("<br/>"));
        return switch (node.shape()) {
            case NodeStyle.ELLIPSE -> "([\"%s\"])".formatted(label);
            case NodeStyle.DIAMOND -> "{\"%s\"}".formatted(label);
            case NodeStyle.PARALLELOGRAM -> "[/\"%s\"/]".formatted(label);
            default -> "[\"%s\"]".formatted(label);
        };
    }

    private static String nodeId(int id) {
        return "n" + id;
    }

    static String escape(String text) {
        return text.replace("\"", "#quot;")
                .replace("<", "#lt;")
                .replace(">", "#gt;")
                .replace("\r", "")
                .replace("\n", " ");
    }
}

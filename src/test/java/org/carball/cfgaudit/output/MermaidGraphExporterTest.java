package org.carball.cfgaudit.output;

import org.carball.cfgaudit.model.graph.ControlFlowGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class MermaidGraphExporterTest {

    private MermaidGraphExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new MermaidGraphExporter(new GraphDescriber(new LabelWrapper()));
    }

    @Test
    void shouldExportStraightLineGraph() {
        // When
        String mermaid = exporter.export(GraphExportFixtures.singleAssignment());

        // Then
        assertThat(mermaid).isEqualTo("""
                flowchart TB
                  n0(["START"])
                  n1["x = 1"]
                  n2(["END"])

                  n0 --> n1
                  n1 --> n2

                  style n0 fill:lightgreen
                  style n1 fill:lightyellow
                  style n2 fill:lightcoral
                """);
    }

    @Test
    void shouldRenderShapesAndEscapeLabels() {
        // When
        String mermaid = exporter.export(GraphExportFixtures.branchAndLoop());

        // Then
        assertThat(mermaid)
                .contains("  n1[/\"name = input(#quot;Name? #quot;)\"/]")
                .contains("  n2{\"x #gt; 0\"}")
                .contains("  n2 -->|\"True\"| n3")
                .contains("  n2 -->|\"False\"| n4")
                .contains("  n6[\"step(x, long_argument_name,<br/>other)\"]")
                .contains("  style n6 fill:plum");
    }

    @Test
    void shouldPreserveNodeAndEdgeCounts() {
        // Given
        ControlFlowGraph graph = GraphExportFixtures.branchAndLoop();

        // When
        String[] lines = exporter.export(graph).split("\n");

        // Then
        long styleLines = Arrays.stream(lines).filter(l -> l.startsWith("  style ")).count();
        long edgeLines = Arrays.stream(lines).filter(l -> l.matches("  n\\d+ -->.*")).count();
        assertThat(styleLines).isEqualTo(graph.nodeCount());
        assertThat(edgeLines).isEqualTo(graph.edgeCount());
    }

    @Test
    void shouldBeDeterministic() {
        assertThat(exporter.export(GraphExportFixtures.branchAndLoop()))
                .isEqualTo(exporter.export(GraphExportFixtures.branchAndLoop()));
    }

    @Test
    void shouldExportEmptyGraphAsEmptyString() {
        assertThat(exporter.export(ControlFlowGraph.empty())).isEmpty();
    }

    @Test
    void shouldCreateExportersFromFormat() {
        LabelWrapper wrapper = new LabelWrapper();

        assertThat(GraphFormat.MERMAID.createExporter(wrapper)).isInstanceOf(MermaidGraphExporter.class);
        assertThat(GraphFormat.DOT.createExporter(wrapper).id()).isEqualTo("dot");
        assertThat(GraphFormat.MERMAID.getFileExtension()).isEqualTo("mmd");
        assertThat(GraphFormat.DOT.createExporter(wrapper).displayName()).isEqualTo("Graphviz DOT");
        assertThat(GraphFormat.MERMAID.createExporter(wrapper).displayName()).isEqualTo("Mermaid Flowchart");
    }
}

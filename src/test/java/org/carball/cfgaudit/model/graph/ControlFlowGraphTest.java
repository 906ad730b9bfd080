package org.carball.cfgaudit.model.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ControlFlowGraphTest {

    @Test
    void shouldRejectSparseIds() {
        List<FlowNode> nodes = List.of(
                new FlowNode(0, "START", NodeKind.START, null, List.of(), Set.of()),
                new FlowNode(2, "END", NodeKind.END, null, List.of(), Set.of()));

        assertThatThrownBy(() -> new ControlFlowGraph(nodes))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dense");
    }

    @Test
    void shouldRejectEdgesToMissingNodes() {
        List<FlowNode> nodes = List.of(
                new FlowNode(0, "START", NodeKind.START, null, List.of(FlowEdge.unlabeled(5)), Set.of()));

        assertThatThrownBy(() -> new ControlFlowGraph(nodes))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing node");
    }

    @Test
    void shouldCountEveryKindIncludingAbsentOnes() {
        // Given
        ControlFlowGraph graph = new ControlFlowGraph(List.of(
                new FlowNode(0, "START", NodeKind.START, null, List.of(FlowEdge.unlabeled(1)), Set.of()),
                new FlowNode(1, "END", NodeKind.END, null, List.of(), Set.of(0))));

        // When
        var counts = graph.countsByKind();

        // Then
        assertThat(counts).hasSize(NodeKind.values().length);
        assertThat(counts.get(NodeKind.START)).isEqualTo(1);
        assertThat(counts.get(NodeKind.DECISION)).isZero();
        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    void shouldNormalizeMissingEdgeLabel() {
        FlowEdge edge = new FlowEdge(3, null);

        assertThat(edge.isLabeled()).isFalse();
        assertThat(edge.withLabel(FlowEdge.TRUE).isLabeled()).isTrue();
    }
}

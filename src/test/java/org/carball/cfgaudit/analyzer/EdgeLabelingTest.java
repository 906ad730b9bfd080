package org.carball.cfgaudit.analyzer;

import org.carball.cfgaudit.model.graph.FlowEdge;
import org.carball.cfgaudit.model.graph.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EdgeLabelingTest {

    @Test
    void shouldLabelConditionalEdgesByInsertionOrder() {
        // When
        List<FlowEdge> labeled = BranchOrderLabeling.INSTANCE.label(1,
                List.of(FlowEdge.unlabeled(5), FlowEdge.unlabeled(2)));

        // Then
        assertThat(labeled).containsExactly(new FlowEdge(5, "True"), new FlowEdge(2, "False"));
    }

    @Test
    void shouldRejectConditionalWithSingleEdge() {
        assertThatThrownBy(() -> BranchOrderLabeling.INSTANCE.label(1, List.of(FlowEdge.unlabeled(2))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected two outgoing edges");
    }

    @Test
    void shouldLabelLoopEdgesByBodyMembershipRegardlessOfOrder() {
        // Given: body occupies ids 3..5, exit edge inserted first
        LoopBodyLabeling labeling = new LoopBodyLabeling(3, 6);

        // When
        List<FlowEdge> labeled = labeling.label(2, List.of(FlowEdge.unlabeled(9), FlowEdge.unlabeled(3)));

        // Then
        assertThat(labeled).containsExactly(new FlowEdge(9, "False"), new FlowEdge(3, "True"));
    }

    @Test
    void shouldLabelSelfLoopAsTrue() {
        // When
        List<FlowEdge> labeled = new LoopBodyLabeling(2, 2).label(1,
                List.of(FlowEdge.unlabeled(1), FlowEdge.unlabeled(2)));

        // Then
        assertThat(labeled).containsExactly(new FlowEdge(1, "True"), new FlowEdge(2, "False"));
    }

    @Test
    void shouldRejectLoopWithoutExitEdge() {
        assertThatThrownBy(() -> new LoopBodyLabeling(2, 4).label(1, List.of(FlowEdge.unlabeled(2))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("one True and one False");
    }

    @Test
    void shouldOnlyRelabelDecisionNodes() {
        // Given
        GraphArena arena = new GraphArena();
        int process = arena.createNode("x = 1", NodeKind.PROCESS, "ignored");

        // When/Then
        assertThatThrownBy(() -> arena.relabel(process, BranchOrderLabeling.INSTANCE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not a decision");
        assertThat(arena.freeze().node(process).condition()).isNull();
    }
}

package org.carball.cfgaudit.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.cfgaudit.model.graph.ControlFlowGraph;
import org.carball.cfgaudit.model.graph.NodeKind;
import org.carball.cfgaudit.model.statement.Assignment;
import org.carball.cfgaudit.model.statement.AugmentedAssignment;
import org.carball.cfgaudit.model.statement.CallExpression;
import org.carball.cfgaudit.model.statement.Conditional;
import org.carball.cfgaudit.model.statement.Expression;
import org.carball.cfgaudit.model.statement.ExpressionStatement;
import org.carball.cfgaudit.model.statement.ForLoop;
import org.carball.cfgaudit.model.statement.FunctionDefinition;
import org.carball.cfgaudit.model.statement.OtherStatement;
import org.carball.cfgaudit.model.statement.ProgramUnit;
import org.carball.cfgaudit.model.statement.ReturnStatement;
import org.carball.cfgaudit.model.statement.Statement;
import org.carball.cfgaudit.model.statement.WhileLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a flowchart-style control-flow graph from a statement tree in a single structured pass.
 * <p>
 * Every visit receives the frontier (the open exits) that flows into the statement and returns the
 * frontier that flows out of it, so nested branches and loops never share traversal state.
 * One instance serves exactly one build; use a new builder per program.
 */
@Slf4j
public class ControlFlowGraphBuilder {

    static final String START_LABEL = "START";
    static final String END_LABEL = "END";
    static final String PASS_LABEL = "pass";
    static final String IMPLICIT_RETURN_LABEL = "return None";

    private final CallClassifier callClassifier;
    private final GraphArena arena = new GraphArena();
    private final List<PendingLabel> pendingLoopLabels = new ArrayList<>();
    private boolean used;

    public ControlFlowGraphBuilder() {
        this(CallClassifier.defaults());
    }

    public ControlFlowGraphBuilder(CallClassifier callClassifier) {
        this.callClassifier = callClassifier;
    }

    public ControlFlowGraph build(ProgramUnit program) {
        if (used) {
            throw new IllegalStateException("ControlFlowGraphBuilder instances build a single graph");
        }
        used = true;

        int start = arena.createNode(START_LABEL, NodeKind.START, null);
        Frontier frontier = visitSequence(program.body(), Frontier.of(start));
        int end = arena.createNode(END_LABEL, NodeKind.END, null);
        arena.connectFrontierTo(frontier, end);

        // loop exits are only attached once the surrounding flow continues
        for (PendingLabel pending : pendingLoopLabels) {
            arena.relabel(pending.decisionId(), pending.labeling());
        }

        ControlFlowGraph graph = arena.freeze();
        log.debug("Built control-flow graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    Frontier visitSequence(List<Statement> statements, Frontier frontier) {
        Frontier current = frontier;
        for (Statement statement : statements) {
            current = visit(statement, current);
        }
        return current;
    }

    Frontier visit(Statement statement, Frontier frontier) {
        if (statement instanceof FunctionDefinition function) {
            return visitFunction(function, frontier);
        } else if (statement instanceof Conditional conditional) {
            return visitConditional(conditional, frontier);
        } else if (statement instanceof WhileLoop loop) {
            return visitLoop(render(loop.condition()), loop.body(), frontier);
        } else if (statement instanceof ForLoop loop) {
            String header = "for " + render(loop.target()) + " in " + render(loop.iterable());
            return visitLoop(header, loop.body(), frontier);
        } else if (statement instanceof ReturnStatement returnStatement) {
            return visitReturn(returnStatement, frontier);
        } else if (statement instanceof Assignment assignment) {
            return visitAssignment(assignment, frontier);
        } else if (statement instanceof AugmentedAssignment assignment) {
            String text = render(assignment.target()) + " " + assignment.operator() + "= " + render(assignment.value());
            return append(text, NodeKind.PROCESS, frontier);
        } else if (statement instanceof ExpressionStatement expression) {
            return visitExpression(expression, frontier);
        } else {
            return visitOther(statement, frontier);
        }
    }

    private Frontier visitFunction(FunctionDefinition function, Frontier frontier) {
        String signature = "def " + function.name() + "(" + String.join(", ", function.parameters()) + ")";
        Frontier current = append(signature, NodeKind.START, frontier);
        current = visitSequence(function.body(), current);

        boolean explicitReturn = function.body().stream().anyMatch(s -> s instanceof ReturnStatement);
        if (!explicitReturn) {
            current = append(IMPLICIT_RETURN_LABEL, NodeKind.OUTPUT, current);
        }
        return current;
    }

    private Frontier visitConditional(Conditional conditional, Frontier frontier) {
        String condition = render(conditional.condition());
        int decision = arena.createNode(condition, NodeKind.DECISION, condition);
        Frontier entry = arena.connectFrontierTo(frontier, decision);

        Frontier trueExit = visitBranch(conditional.thenBody(), entry);
        // an elif chain is a nested conditional rooted at this decision's false side
        Frontier falseExit = visitBranch(conditional.elseBody(), entry);

        arena.relabel(decision, BranchOrderLabeling.INSTANCE);
        return trueExit.union(falseExit);
    }

    /**
     * An empty branch still gets a pass-through node, so the decision always ends up with two distinct edges.
     */
    private Frontier visitBranch(List<Statement> branch, Frontier entry) {
        if (branch.isEmpty()) {
            return append(PASS_LABEL, NodeKind.PROCESS, entry);
        }
        return visitSequence(branch, entry);
    }

    private Frontier visitLoop(String header, List<Statement> body, Frontier frontier) {
        int decision = arena.createNode(header, NodeKind.DECISION, header);
        Frontier entry = arena.connectFrontierTo(frontier, decision);

        int bodyStart = arena.nextId();
        Frontier bodyExit = visitSequence(body, entry);
        int bodyEnd = arena.nextId();

        for (int id : bodyExit.ids()) {
            arena.addEdge(id, decision);
        }
        pendingLoopLabels.add(new PendingLabel(decision, new LoopBodyLabeling(bodyStart, bodyEnd)));
        return Frontier.of(decision);
    }

    private Frontier visitReturn(ReturnStatement returnStatement, Frontier frontier) {
        String text = returnStatement.valueExpression()
                .map(value -> "return " + render(value))
                .orElse("return");
        append(text, NodeKind.OUTPUT, frontier);
        return Frontier.empty();
    }

    private Frontier visitAssignment(Assignment assignment, Frontier frontier) {
        String targets = assignment.targets().stream()
                .map(this::render)
                .collect(Collectors.joining(" = "));
        return append(targets + " = " + render(assignment.value()), NodeKind.PROCESS, frontier);
    }

    private Frontier visitExpression(ExpressionStatement statement, Frontier frontier) {
        Expression expression = statement.expression();
        NodeKind kind = expression instanceof CallExpression call
                ? callClassifier.classify(call)
                : NodeKind.PROCESS;
        return append(render(expression), kind, frontier);
    }

    private Frontier visitOther(Statement statement, Frontier frontier) {
        String text = null;
        if (statement instanceof OtherStatement other) {
            text = other.text();
        } else if (statement instanceof ProgramUnit) {
            log.debug("Nested program unit treated as an opaque statement");
        }
        if (text == null || text.isBlank()) {
            text = placeholder(statement.kindName());
        }
        return append(text.strip(), NodeKind.PROCESS, frontier);
    }

    private Frontier append(String label, NodeKind kind, Frontier frontier) {
        int id = arena.createNode(label, kind, null);
        return arena.connectFrontierTo(frontier, id);
    }

    private String render(Expression expression) {
        try {
            String text = expression.render();
            if (text != null && !text.isBlank()) {
                return text;
            }
        } catch (RuntimeException e) {
            log.debug("Could not render {} expression: {}", expression.kind(), e.getMessage());
        }
        return placeholder(expression.kind());
    }

    static String placeholder(String kindName) {
        return "# " + kindName;
    }

    private record PendingLabel(int decisionId, EdgeLabeling labeling) {
    }
}

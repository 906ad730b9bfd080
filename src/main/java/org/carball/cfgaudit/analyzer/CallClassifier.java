package org.carball.cfgaudit.analyzer;

import org.carball.cfgaudit.model.graph.NodeKind;
import org.carball.cfgaudit.model.statement.CallExpression;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a call to Output, Input or a plain Call node by its callee's simple name.
 */
public class CallClassifier {

    public static final Set<String> DEFAULT_OUTPUT_CALLEES = Set.of("print", "println", "printf");
    public static final Set<String> DEFAULT_INPUT_CALLEES = Set.of("input", "readline", "nextline", "scanf");

    private final Set<String> outputCallees;
    private final Set<String> inputCallees;

    public CallClassifier(Collection<String> outputCallees, Collection<String> inputCallees) {
        this.outputCallees = normalize(outputCallees);
        this.inputCallees = normalize(inputCallees);
    }

    public static CallClassifier defaults() {
        return new CallClassifier(DEFAULT_OUTPUT_CALLEES, DEFAULT_INPUT_CALLEES);
    }

    public NodeKind classify(CallExpression call) {
        String name = call.simpleName().toLowerCase(Locale.ROOT);
        if (outputCallees.contains(name)) {
            return NodeKind.OUTPUT;
        }
        if (inputCallees.contains(name)) {
            return NodeKind.INPUT;
        }
        return NodeKind.CALL;
    }

    private static Set<String> normalize(Collection<String> names) {
        return names.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}

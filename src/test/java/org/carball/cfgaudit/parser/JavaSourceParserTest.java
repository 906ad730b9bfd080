package org.carball.cfgaudit.parser;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaSourceParserTest {

    private JavaSourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new JavaSourceParser();
    }

    @Test
    void shouldTurnEachMethodIntoFunctionDefinition() throws Exception {
        // When
        ProgramUnit program = parser.parse(fixture("Accumulator.java"));

        // Then
        assertThat(program.body()).hasSize(2);
        FunctionDefinition sum = (FunctionDefinition) program.body().get(0);
        assertThat(sum.name()).isEqualTo("sumPositive");
        assertThat(sum.parameters()).containsExactly("values");
        assertThat(sum.body()).hasSize(4);

        Assignment init = (Assignment) sum.body().get(0);
        assertThat(init.targets().get(0).render()).isEqualTo("total");
        assertThat(init.value().render()).isEqualTo("0");

        ForLoop loop = (ForLoop) sum.body().get(1);
        assertThat(loop.target().render()).isEqualTo("value");
        assertThat(loop.iterable().render()).isEqualTo("values");
        Conditional positive = (Conditional) loop.body().get(0);
        assertThat(positive.condition().render()).isEqualTo("value > 0");
        AugmentedAssignment add = (AugmentedAssignment) positive.thenBody().get(0);
        assertThat(add.operator()).isEqualTo("+");
        assertThat(positive.elseBody()).isEmpty();

        ExpressionStatement println = (ExpressionStatement) sum.body().get(2);
        assertThat(println.expression()).isEqualTo(CallExpression.of("System.out.println", "System.out.println(total)"));
        assertThat(sum.body().get(3)).isInstanceOf(ReturnStatement.class);

        FunctionDefinition countDown = (FunctionDefinition) program.body().get(1);
        WhileLoop whileLoop = (WhileLoop) countDown.body().get(0);
        assertThat(whileLoop.condition().render()).isEqualTo("n > 0");
        assertThat(((AugmentedAssignment) whileLoop.body().get(0)).operator()).isEqualTo("-");
    }

    @Test
    void shouldFallBackToBlockOfStatements() throws Exception {
        // Given
        String source = """
                int x = 1;
                if (x > 0) {
                    x = 2;
                } else if (x < 0) {
                    x = 3;
                } else {
                    x = 4;
                }
                """;

        // When
        ProgramUnit program = parser.parse(source);

        // Then
        assertThat(program.body()).hasSize(2);
        Conditional conditional = (Conditional) program.body().get(1);
        assertThat(conditional.hasElifChain()).isTrue();
        Conditional elif = (Conditional) conditional.elseBody().get(0);
        assertThat(elif.condition().render()).isEqualTo("x < 0");
        assertThat(elif.elseBody()).hasSize(1);
    }

    @Test
    void shouldLowerCountingForLoopToWhileLoop() throws Exception {
        // When
        ProgramUnit program = parser.parse("for (int i = 0; i < 3; i++) { total += i; }");

        // Then
        assertThat(program.body()).hasSize(2);
        assertThat(((Assignment) program.body().get(0)).targets().get(0).render()).isEqualTo("i");
        WhileLoop loop = (WhileLoop) program.body().get(1);
        assertThat(loop.condition().render()).isEqualTo("i < 3");
        assertThat(loop.body()).hasSize(2);
        assertThat(loop.body().get(0)).isInstanceOf(AugmentedAssignment.class);
        assertThat(((ExpressionStatement) loop.body().get(1)).expression().render()).isEqualTo("i++");
    }

    @Test
    void shouldUseTrueConditionForEndlessForLoop() throws Exception {
        // When
        ProgramUnit program = parser.parse("for (;;) { tick(); }");

        // Then
        WhileLoop loop = (WhileLoop) program.body().get(0);
        assertThat(loop.condition().render()).isEqualTo("true");
    }

    @Test
    void shouldFlattenChainedAssignment() throws Exception {
        // When
        ProgramUnit program = parser.parse("a = b = 5;");

        // Then
        Assignment assignment = (Assignment) program.body().get(0);
        assertThat(assignment.targets()).extracting(Expression::render).containsExactly("a", "b");
        assertThat(assignment.value().render()).isEqualTo("5");
    }

    @Test
    void shouldKeepUnsupportedStatementsAsOther() throws Exception {
        // When
        ProgramUnit program = parser.parse("int y;\ntry { work(); } catch (Exception e) { }");

        // Then
        List<Statement> body = program.body();
        assertThat(body).hasSize(2);
        assertThat(body.get(0)).isEqualTo(new OtherStatement("VariableDeclarationExpr", "int y"));
        assertThat(body.get(1).kindName()).isEqualTo("TryStmt");
    }

    @Test
    void shouldReportSyntaxErrors() {
        assertThatThrownBy(() -> parser.parse("int x = ;"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("Syntax error");
    }

    @Test
    void shouldRejectEmptySource() {
        assertThatThrownBy(() -> parser.parse(""))
                .isInstanceOf(SourceParseException.class);
    }

    @Test
    void shouldPickParserByFileExtension() {
        assertThat(StatementTreeParsers.forFile(Path.of("tree.JSON"))).isInstanceOf(JsonStatementTreeParser.class);
        assertThat(StatementTreeParsers.forFile(Path.of("src/Main.java"))).isInstanceOf(JavaSourceParser.class);
    }

    private String fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}

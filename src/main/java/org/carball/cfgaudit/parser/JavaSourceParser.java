package org.carball.cfgaudit.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import lombok.extern.slf4j.Slf4j;
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
import org.carball.cfgaudit.model.statement.SourceExpression;
import org.carball.cfgaudit.model.statement.Statement;
import org.carball.cfgaudit.model.statement.WhileLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Adapts JavaParser's AST to the statement tree.
 * <p>
 * A compilation unit becomes a program whose body is one function definition per method or constructor,
 * in declaration order. Source that is not a compilation unit is parsed as a bare block of statements.
 */
@Slf4j
public class JavaSourceParser implements StatementTreeParser {

    private final JavaParser javaParser;

    public JavaSourceParser() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(configuration);
    }

    @Override
    public String name() {
        return "java";
    }

    @Override
    public ProgramUnit parse(String source) throws SourceParseException {
        if (source == null || source.isBlank()) {
            throw new SourceParseException("Source is empty");
        }

        ParseResult<CompilationUnit> unit = javaParser.parse(source);
        if (unit.isSuccessful() && unit.getResult().isPresent()) {
            List<Statement> functions = new ArrayList<>();
            for (TypeDeclaration<?> type : unit.getResult().get().getTypes()) {
                collectFunctions(type, functions);
            }
            log.debug("Parsed compilation unit with {} methods", functions.size());
            return new ProgramUnit(functions);
        }

        ParseResult<BlockStmt> block = javaParser.parseBlock("{\n" + source + "\n}");
        if (block.isSuccessful() && block.getResult().isPresent()) {
            log.debug("Parsed source as a block of statements");
            return new ProgramUnit(convertBlock(block.getResult().get()));
        }

        String problem = unit.getProblems().stream()
                .findFirst()
                .map(Problem::getMessage)
                .orElse("unknown syntax error");
        log.warn("Java source could not be parsed: {}", problem);
        throw new SourceParseException("Syntax error in source: " + problem);
    }

    private void collectFunctions(TypeDeclaration<?> type, List<Statement> functions) {
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof MethodDeclaration method) {
                method.getBody().ifPresent(body ->
                        functions.add(new FunctionDefinition(method.getNameAsString(), parameterNames(method.getParameters()),
                                convertBlock(body))));
            } else if (member instanceof ConstructorDeclaration constructor) {
                functions.add(new FunctionDefinition(constructor.getNameAsString(),
                        parameterNames(constructor.getParameters()), convertBlock(constructor.getBody())));
            } else if (member instanceof TypeDeclaration<?> nested) {
                collectFunctions(nested, functions);
            }
        }
    }

    private List<String> parameterNames(List<Parameter> parameters) {
        return parameters.stream()
                .map(Parameter::getNameAsString)
                .collect(Collectors.toList());
    }

    /**
     * Blocks are flattened: a nested block contributes its statements in place.
     */
    private List<Statement> convertBlock(com.github.javaparser.ast.stmt.Statement statement) {
        if (statement instanceof BlockStmt block) {
            List<Statement> statements = new ArrayList<>();
            for (com.github.javaparser.ast.stmt.Statement child : block.getStatements()) {
                statements.addAll(convertBlock(child));
            }
            return statements;
        }
        return convert(statement);
    }

    private List<Statement> convert(com.github.javaparser.ast.stmt.Statement statement) {
        if (statement instanceof IfStmt ifStmt) {
            List<Statement> elseBody = ifStmt.getElseStmt()
                    .map(this::convertBlock)
                    .orElseGet(List::of);
            return List.of(new Conditional(expression(ifStmt.getCondition()), convertBlock(ifStmt.getThenStmt()), elseBody));
        } else if (statement instanceof WhileStmt whileStmt) {
            return List.of(new WhileLoop(expression(whileStmt.getCondition()), convertBlock(whileStmt.getBody())));
        } else if (statement instanceof ForEachStmt forEach) {
            String variable = forEach.getVariable().getVariables().get(0).getNameAsString();
            return List.of(new ForLoop(new SourceExpression("Name", variable), expression(forEach.getIterable()),
                    convertBlock(forEach.getBody())));
        } else if (statement instanceof ForStmt forStmt) {
            return lowerCountingLoop(forStmt);
        } else if (statement instanceof ReturnStmt returnStmt) {
            return List.of(new ReturnStatement(returnStmt.getExpression().map(this::expression).orElse(null)));
        } else if (statement instanceof ExpressionStmt expressionStmt) {
            return convertExpression(expressionStmt.getExpression());
        }
        return List.of(other(statement));
    }

    /**
     * {@code for (init; cmp; update) body} becomes the init statements followed by
     * {@code while (cmp) { body; update }}.
     */
    private List<Statement> lowerCountingLoop(ForStmt forStmt) {
        List<Statement> lowered = new ArrayList<>();
        forStmt.getInitialization().forEach(init -> lowered.addAll(convertExpression(init)));

        Expression condition = forStmt.getCompare()
                .map(this::expression)
                .orElseGet(() -> new SourceExpression("BooleanLiteralExpr", "true"));
        List<Statement> body = new ArrayList<>(convertBlock(forStmt.getBody()));
        forStmt.getUpdate().forEach(update -> body.addAll(convertExpression(update)));

        lowered.add(new WhileLoop(condition, body));
        return lowered;
    }

    private List<Statement> convertExpression(com.github.javaparser.ast.expr.Expression expr) {
        if (expr instanceof AssignExpr assign) {
            return List.of(convertAssignment(assign));
        } else if (expr instanceof VariableDeclarationExpr declaration) {
            List<Statement> statements = new ArrayList<>();
            for (VariableDeclarator declarator : declaration.getVariables()) {
                statements.add(declarator.getInitializer()
                        .<Statement>map(init -> new Assignment(
                                List.of(new SourceExpression("Name", declarator.getNameAsString())), expression(init)))
                        .orElseGet(() -> new OtherStatement("VariableDeclarationExpr",
                                declaration.getElementType() + " " + declarator.getNameAsString())));
            }
            return statements;
        } else if (expr instanceof MethodCallExpr call) {
            String callee = call.getScope()
                    .map(scope -> scope + "." + call.getNameAsString())
                    .orElse(call.getNameAsString());
            return List.of(new ExpressionStatement(CallExpression.of(callee, call.toString())));
        }
        return List.of(new ExpressionStatement(expression(expr)));
    }

    private Statement convertAssignment(AssignExpr assign) {
        if (assign.getOperator() != AssignExpr.Operator.ASSIGN) {
            String operator = assign.getOperator().asString();
            return new AugmentedAssignment(expression(assign.getTarget()),
                    operator.substring(0, operator.length() - 1), expression(assign.getValue()));
        }

        // a = b = value
        List<Expression> targets = new ArrayList<>();
        com.github.javaparser.ast.expr.Expression value = assign;
        while (value instanceof AssignExpr chained && chained.getOperator() == AssignExpr.Operator.ASSIGN) {
            targets.add(expression(chained.getTarget()));
            value = chained.getValue();
        }
        return new Assignment(targets, expression(value));
    }

    private Expression expression(com.github.javaparser.ast.expr.Expression expr) {
        return new SourceExpression(expr.getClass().getSimpleName(), expr.toString());
    }

    private OtherStatement other(com.github.javaparser.ast.stmt.Statement statement) {
        return new OtherStatement(statement.getClass().getSimpleName(), statement.toString());
    }
}

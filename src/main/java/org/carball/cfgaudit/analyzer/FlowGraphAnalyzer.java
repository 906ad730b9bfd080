package org.carball.cfgaudit.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.cfgaudit.config.AnalyzerConfig;
import org.carball.cfgaudit.config.ExportSettings;
import org.carball.cfgaudit.model.analysis.AnalysisResult;
import org.carball.cfgaudit.model.analysis.ComplexityReport;
import org.carball.cfgaudit.model.graph.ControlFlowGraph;
import org.carball.cfgaudit.model.statement.ProgramUnit;
import org.carball.cfgaudit.parser.SourceParseException;
import org.carball.cfgaudit.parser.StatementTreeParser;
import org.carball.cfgaudit.parser.StatementTreeParsers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs parse, build and measure for one source file.
 */
@Slf4j
public class FlowGraphAnalyzer {

    private final AnalyzerConfig config;
    private final ExportSettings settings;
    private final ComplexityAnalyzer complexityAnalyzer;

    public FlowGraphAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.settings = config.getExportSettings() != null ?
                config.getExportSettings() : ExportSettings.defaults();
        this.complexityAnalyzer = new ComplexityAnalyzer();

        log.info("Initialized FlowGraphAnalyzer for {}", config.getSourceFile());
    }

    public AnalysisResult analyze() throws IOException, SourceParseException {
        Path sourceFile = config.getSourceFile();

        if (config.isVerbose()) {
            System.out.println("  - Reading " + sourceFile + "...");
        }
        String source = Files.readString(sourceFile);

        StatementTreeParser parser = StatementTreeParsers.forFile(sourceFile);
        return analyzeSource(sourceFile.getFileName().toString(), source, parser);
    }

    /**
     * A parse failure propagates unchanged; no partial graph is produced for unparseable source.
     */
    public AnalysisResult analyzeSource(String sourceName, String source, StatementTreeParser parser)
            throws SourceParseException {
        log.info("Starting control-flow analysis of {} using the {} parser", sourceName, parser.name());

        if (config.isVerbose()) {
            System.out.println("  - Parsing statement tree...");
        }
        ProgramUnit program = parser.parse(source);
        log.info("Parsed {} top-level statements", program.body().size());

        if (config.isVerbose()) {
            System.out.println("  - Building control-flow graph...");
        }
        ControlFlowGraph graph = new ControlFlowGraphBuilder(settings.getCallClassifier()).build(program);

        if (config.isVerbose()) {
            System.out.println("  - Measuring complexity...");
        }
        ComplexityReport complexity = complexityAnalyzer.analyze(graph);

        log.info("Analysis complete. {} nodes, {} edges, cyclomatic complexity {} ({})",
                graph.nodeCount(), graph.edgeCount(), complexity.cyclomaticComplexity(),
                complexity.riskRating().getDisplayName());

        return new AnalysisResult(sourceName, graph, complexity);
    }
}

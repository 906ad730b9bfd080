package org.carball.cfgaudit.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.cfgaudit.analyzer.ComplexityAnalyzer;
import org.carball.cfgaudit.analyzer.FlowGraphAnalyzer;
import org.carball.cfgaudit.config.AnalyzerConfig;
import org.carball.cfgaudit.config.ConfigurationLoader;
import org.carball.cfgaudit.config.ExportSettings;
import org.carball.cfgaudit.config.OutputFormat;
import org.carball.cfgaudit.model.analysis.AnalysisResult;
import org.carball.cfgaudit.model.analysis.ComplexityReport;
import org.carball.cfgaudit.model.graph.NodeKind;
import org.carball.cfgaudit.output.FlowReport;
import org.carball.cfgaudit.output.GraphExporter;
import org.carball.cfgaudit.output.GraphFormat;
import org.carball.cfgaudit.parser.SourceParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;

@Slf4j
public class CfgAuditCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        Control Flow Graph & Complexity Analyzer v%s         ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one analysis and returns the process exit code.
     */
    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            AnalyzerConfig config = parseArgs(args);

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Source file: " + config.getSourceFile());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println("   Graph: " + config.getGraphOutputFile());
            System.out.println();

            FlowGraphAnalyzer analyzer = new FlowGraphAnalyzer(config);

            System.out.print("📊 Building control-flow graph... ");
            AnalysisResult result = analyzer.analyze();
            System.out.println("✓");

            GraphExporter exporter = config.getGraphFormat()
                    .createExporter(config.getExportSettings().getLabelWrapper());
            System.out.print("🖼️ Exporting " + exporter.displayName() + " description... ");
            String graphDescription = exporter.export(result.graph());
            Files.writeString(Paths.get(config.getGraphOutputFile()), graphDescription);
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            outputResults(result, graphDescription, exporter.id(), config);
            System.out.println("✓");

            printSummary(result);

            System.out.println("\n✅ Analysis complete!");
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + config.getOutputFile());
            }
            System.out.println("   Graph file: " + config.getGraphOutputFile());
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (SourceParseException e) {
            System.err.println("\n❌ No graph produced: " + e.getMessage());
            log.debug("Parse error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar cfg-audit.jar <source-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  source-file         Java source file, or a JSON statement tree (.json)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: cfg-report.json)");
        System.out.println("  --format, -f        Report format: json|markdown|both (default: json)");
        System.out.println("  --graph             Graph dialect: dot|mermaid (default: dot)");
        System.out.println("  --graph-output      Output file for the graph description (default: <report>.dot|.mmd)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println("Examples:");
        System.out.println("  # Analyze a Java file and write a Graphviz graph");
        System.out.println("  java -jar cfg-audit.jar src/Main.java");
        System.out.println();
        System.out.println("  # Markdown report with a Mermaid flowchart");
        System.out.println("  java -jar cfg-audit.jar tree.json -f markdown --graph mermaid");
    }

    static AnalyzerConfig parseArgs(String[] args) {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setSourceFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("cfg-report.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setGraphFormat(GraphFormat.DOT);
        config.setVerbose(false);

        Path settingsFile = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--graph":
                    String graph = requireValue(args, i++, "Graph format not specified");
                    try {
                        config.setGraphFormat(GraphFormat.valueOf(graph.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid graph format. Use: dot or mermaid");
                    }
                    break;

                case "--graph-output":
                    config.setGraphOutputFile(requireValue(args, i++, "Graph output file not specified"));
                    break;

                case "--settings":
                    settingsFile = Paths.get(requireValue(args, i++, "Settings file not specified"));
                    break;

                case "--export.wrap-width":
                case "--export.output-callees":
                case "--export.input-callees":
                    // value is applied by ConfigurationLoader
                    requireValue(args, i, "Value not specified for " + args[i]);
                    i++;
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        // Apply correct file extension based on format
        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }
        if (config.getGraphOutputFile() == null) {
            config.setGraphOutputFile(baseFileName + "." + config.getGraphFormat().getFileExtension());
        }

        ExportSettings settings = new ConfigurationLoader().loadSettings(settingsFile, args);
        config.setExportSettings(settings);

        validateConfig(config);

        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(AnalyzerConfig config) {
        if (!Files.exists(config.getSourceFile())) {
            throw new IllegalArgumentException("Source file not found: " + config.getSourceFile());
        }

        if (Files.isDirectory(config.getSourceFile())) {
            throw new IllegalArgumentException("Source path must be a file, not a directory");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }

        Path graphDir = Paths.get(config.getGraphOutputFile()).getParent();
        if (graphDir != null && !Files.exists(graphDir)) {
            throw new IllegalArgumentException("Graph output directory does not exist: " + graphDir);
        }
    }

    private static void outputResults(AnalysisResult result, String graphDescription, String graphFormat,
                                      AnalyzerConfig config) throws IOException {

        FlowReport report = new FlowReport(result, graphDescription, graphFormat);
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            String jsonFile = config.getOutputFormat() == OutputFormat.BOTH ?
                baseFileName + ".json" : config.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            String markdownFile = config.getOutputFormat() == OutputFormat.BOTH ?
                baseFileName + ".md" : config.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    private static void printSummary(AnalysisResult result) {
        ComplexityReport complexity = result.complexity();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));
        System.out.println();
        System.out.print(new ComplexityAnalyzer().generateComplexityReport(complexity));

        System.out.println("\nNodes by kind:");
        for (NodeKind kind : NodeKind.values()) {
            System.out.printf("  %-10s %d%n", kind.getToken(), complexity.count(kind));
        }

        String marker = switch (complexity.riskRating()) {
            case LOW -> "🟢";
            case MODERATE -> "🟡";
            case HIGH -> "🔴";
            case VERY_HIGH -> "⛔";
        };
        System.out.println("\n" + marker + " " + complexity.riskRating().getDisplayName() + ": "
                + complexity.riskRating().getRecommendation());
    }
}

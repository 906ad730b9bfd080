package org.carball.cfgaudit.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.cfgaudit.model.analysis.AnalysisResult;
import org.carball.cfgaudit.model.analysis.ComplexityReport;
import org.carball.cfgaudit.model.analysis.RiskRating;
import org.carball.cfgaudit.model.graph.FlowEdge;
import org.carball.cfgaudit.model.graph.FlowNode;
import org.carball.cfgaudit.model.graph.NodeKind;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class FlowReport {

    static final String ANALYZER_VERSION = "1.0.0";

    private final AnalysisResult analysisResult;
    private final String graphDescription;
    private final String graphFormat;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public FlowReport(AnalysisResult analysisResult, String graphDescription, String graphFormat) {
        this(analysisResult, graphDescription, graphFormat, LocalDateTime.now());
    }

    public FlowReport(AnalysisResult analysisResult, String graphDescription, String graphFormat, LocalDateTime timestamp) {
        this.analysisResult = analysisResult;
        this.graphDescription = graphDescription;
        this.graphFormat = graphFormat;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        ComplexityReport complexity = analysisResult.complexity();
        RiskRating risk = complexity.riskRating();
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Control Flow Graph Complexity Report\n\n");
        md.append("**Source:** ").append(analysisResult.sourceName()).append("  \n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Analyzer Version:** ").append(ANALYZER_VERSION).append("  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Cyclomatic Complexity (M = E - N + 2P) | ").append(complexity.cyclomaticComplexity()).append(" |\n");
        md.append("| Complexity (Decisions + 1) | ").append(complexity.decisionComplexity()).append(" |\n");
        md.append("| Risk Level | ").append(risk.getDisplayName()).append(" |\n");
        md.append("| Total Nodes (N) | ").append(complexity.nodeCount()).append(" |\n");
        md.append("| Total Edges (E) | ").append(complexity.edgeCount()).append(" |\n");
        md.append("| Decision Points | ").append(complexity.count(NodeKind.DECISION)).append(" |\n");
        md.append("| Process Steps | ").append(complexity.count(NodeKind.PROCESS)).append(" |\n");
        md.append("| I/O Operations | ").append(complexity.ioOperations()).append(" |\n");
        md.append("| Function Calls | ").append(complexity.count(NodeKind.CALL)).append(" |\n\n");

        // Calculation details
        md.append("## Complexity Calculation Details\n\n");
        md.append("- **E (Edges):** ").append(complexity.edgeCount()).append("\n");
        md.append("- **N (Nodes):** ").append(complexity.nodeCount()).append("\n");
        md.append("- **P (Connected Components):** ").append(complexity.components()).append("\n\n");
        md.append("**Calculation:** ").append(complexity.edgeCount()).append(" - ").append(complexity.nodeCount())
                .append(" + 2(").append(complexity.components()).append(") = **")
                .append(complexity.cyclomaticComplexity()).append("**\n\n");
        md.append("**Alternative Method (Decision Points + 1):** ").append(complexity.decisionCount())
                .append(" + 1 = **").append(complexity.decisionComplexity()).append("**\n\n");
        md.append("The code has **").append(complexity.cyclomaticComplexity())
                .append("** independent execution paths; that many test cases are needed for full path coverage.\n\n");
        md.append("**Risk level:** ").append(risk.getDisplayName()).append(" - ").append(risk.getRecommendation()).append("\n\n");

        // Risk guide
        md.append("### Risk Bands\n\n");
        md.append("| Complexity | Risk | Recommendation |\n");
        md.append("|------------|------|----------------|\n");
        for (RiskRating rating : RiskRating.values()) {
            md.append("| ").append(rating.getRange()).append(" | ").append(rating.getDisplayName())
                    .append(" | ").append(rating.getRecommendation()).append(" |\n");
        }
        md.append("\n");

        // Node details
        md.append("## Node Details\n\n");
        for (FlowNode node : analysisResult.graph().nodes()) {
            md.append("- **Node ").append(node.id()).append("** (").append(node.kind().getToken()).append("): `")
                    .append(node.label().replace("`", "'")).append("`");
            if (!node.successors().isEmpty()) {
                md.append(" → ").append(node.successors().stream()
                        .map(this::formatSuccessor)
                        .collect(Collectors.joining(", ")));
            }
            md.append("\n");
        }
        md.append("\n");

        if (graphDescription != null && !graphDescription.isEmpty()) {
            md.append("## Graph Description\n\n");
            md.append("```").append(graphFormat == null ? "" : graphFormat).append("\n");
            md.append(graphDescription);
            if (!graphDescription.endsWith("\n")) {
                md.append("\n");
            }
            md.append("```\n\n");
        }

        // Footer
        md.append("---\n\n");
        md.append("*Generated by cfg-audit*\n");

        return md.toString();
    }

    private String formatSuccessor(FlowEdge edge) {
        return edge.isLabeled() ? edge.target() + " (" + edge.label() + ")" : String.valueOf(edge.target());
    }

    private ReportData buildReportData() {
        ComplexityReport complexity = analysisResult.complexity();
        ReportData report = new ReportData();

        report.setAnalysisMetadata(new AnalysisMetadata(
                timestamp,
                analysisResult.sourceName(),
                ANALYZER_VERSION
        ));

        ComplexitySection section = new ComplexitySection();
        section.setCyclomaticComplexity(complexity.cyclomaticComplexity());
        section.setDecisionComplexity(complexity.decisionComplexity());
        section.setRiskRating(complexity.riskRating().getDisplayName());
        section.setRiskColor(complexity.riskRating().getColor());
        section.setNodeCount(complexity.nodeCount());
        section.setEdgeCount(complexity.edgeCount());
        section.setComponents(complexity.components());
        report.setComplexity(section);

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (NodeKind kind : NodeKind.values()) {
            counts.put(kind.getToken(), complexity.count(kind));
        }
        report.setCountsByKind(counts);

        List<NodeDetail> nodes = analysisResult.graph().nodes().stream()
                .map(node -> {
                    NodeDetail detail = new NodeDetail();
                    detail.setId(node.id());
                    detail.setKind(node.kind().getToken());
                    detail.setLabel(node.label());
                    detail.setCondition(node.condition());
                    detail.setSuccessors(node.successors().stream()
                            .map(edge -> new SuccessorDetail(edge.target(), edge.isLabeled() ? edge.label() : null))
                            .collect(Collectors.toList()));
                    return detail;
                })
                .collect(Collectors.toList());
        report.setNodes(nodes);

        if (graphDescription != null && !graphDescription.isEmpty()) {
            report.setGraphFormat(graphFormat);
            report.setGraphDescription(graphDescription);
        }

        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private AnalysisMetadata analysisMetadata;
        private ComplexitySection complexity;
        private Map<String, Integer> countsByKind;
        private List<NodeDetail> nodes;
        private String graphFormat;
        private String graphDescription;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class AnalysisMetadata {
        private LocalDateTime timestamp;
        private String source;
        private String analyzerVersion;
    }

    @lombok.Data
    private static class ComplexitySection {
        private int cyclomaticComplexity;
        private int decisionComplexity;
        private String riskRating;
        private String riskColor;
        private int nodeCount;
        private int edgeCount;
        private int components;
    }

    @lombok.Data
    private static class NodeDetail {
        private int id;
        private String kind;
        private String label;
        private String condition;
        private List<SuccessorDetail> successors;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class SuccessorDetail {
        private int target;
        private String label;
    }
}

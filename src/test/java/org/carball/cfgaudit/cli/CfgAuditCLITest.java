package org.carball.cfgaudit.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.cfgaudit.config.AnalyzerConfig;
import org.carball.cfgaudit.config.OutputFormat;
import org.carball.cfgaudit.output.GraphFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CfgAuditCLITest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteReportsAndGraph() throws Exception {
        // Given
        String report = tempDir.resolve("report.json").toString();
        String[] args = {fixture("Accumulator.java"), "-o", report, "-f", "both", "--graph", "mermaid"};

        // When
        int exitCode = CfgAuditCLI.run(args);

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("report.md")).exists();
        assertThat(Files.readString(tempDir.resolve("report.mmd"))).startsWith("flowchart TB");
        JsonNode json = new ObjectMapper().readTree(tempDir.resolve("report.json").toFile());
        assertThat(json.at("/complexity/cyclomaticComplexity").asInt()).isEqualTo(3);
        assertThat(json.at("/graphFormat").asText()).isEqualTo("mermaid");
    }

    @Test
    void shouldHonourExplicitGraphOutputAndWrapWidth() throws Exception {
        // Given
        Path graph = tempDir.resolve("flow.gv");
        String[] args = {fixture("grade.json"), "-o", tempDir.resolve("out").toString(), "-f", "markdown",
                "--graph-output", graph.toString(), "--export.wrap-width", "12"};

        // When
        int exitCode = CfgAuditCLI.run(args);

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("out.md")).exists();
        assertThat(Files.readString(graph)).contains("digraph {").contains("result =\\ngrade(85)");
    }

    @Test
    void shouldFailOnParseError() throws Exception {
        // Given
        String[] args = {fixture("broken.json"), "-o", tempDir.resolve("r.json").toString()};

        // When/Then
        assertThat(CfgAuditCLI.run(args)).isEqualTo(1);
        assertThat(tempDir.resolve("r.json")).doesNotExist();
    }

    @Test
    void shouldFailOnMissingSourceFile() {
        assertThat(CfgAuditCLI.run(new String[]{tempDir.resolve("nope.java").toString()})).isEqualTo(1);
    }

    @Test
    void shouldShowUsage() {
        assertThat(CfgAuditCLI.run(new String[]{"--help"})).isZero();
        assertThat(CfgAuditCLI.run(new String[0])).isEqualTo(1);
    }

    @Test
    void shouldParseOptionsIntoConfig() throws Exception {
        // When
        AnalyzerConfig config = CfgAuditCLI.parseArgs(new String[]{
                fixture("Accumulator.java"), "-o", tempDir.resolve("audit.txt").toString(), "--graph", "DOT", "-v"});

        // Then
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.getOutputFile()).isEqualTo(tempDir.resolve("audit.json").toString());
        assertThat(config.getGraphFormat()).isEqualTo(GraphFormat.DOT);
        assertThat(config.getGraphOutputFile()).isEqualTo(tempDir.resolve("audit.dot").toString());
        assertThat(config.isVerbose()).isTrue();
        assertThat(config.getExportSettings().getWrapWidth()).isEqualTo(30);
    }

    @Test
    void shouldRejectUnknownOptionsAndFormats() throws Exception {
        String source = fixture("Accumulator.java");

        assertThatThrownBy(() -> CfgAuditCLI.parseArgs(new String[]{source, "--bogus"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option");
        assertThatThrownBy(() -> CfgAuditCLI.parseArgs(new String[]{source, "--graph", "png"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid graph format");
        assertThatThrownBy(() -> CfgAuditCLI.parseArgs(new String[]{source, "-o"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output file not specified");
    }

    private String fixture(String name) throws Exception {
        return Paths.get(getClass().getResource("/fixtures/" + name).toURI()).toString();
    }
}

package org.carball.cfgaudit.config;

import lombok.Data;
import org.carball.cfgaudit.output.GraphFormat;

import java.nio.file.Path;

@Data
public class AnalyzerConfig {
    private Path sourceFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private GraphFormat graphFormat;
    private String graphOutputFile;
    private boolean verbose;
    private ExportSettings exportSettings;
}

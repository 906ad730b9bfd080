package org.carball.cfgaudit.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_WRAP_WIDTH = "CFGAUDIT_WRAP_WIDTH";
    static final String ENV_OUTPUT_CALLEES = "CFGAUDIT_OUTPUT_CALLEES";
    static final String ENV_INPUT_CALLEES = "CFGAUDIT_INPUT_CALLEES";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > settings file > defaults
     */
    public ExportSettings loadSettings(Path settingsFile, String[] args) {
        log.debug("Loading export settings");

        ExportSettings settings = settingsFile != null ? loadSettingsFile(settingsFile) : ExportSettings.defaults();

        applyEnvironmentVariables(settings);
        applyCLIArguments(settings, args);

        settings.validate();

        log.info("Export settings loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    public ExportSettings loadSettings(String[] args) {
        return loadSettings(null, args);
    }

    /**
     * Reads a YAML settings file. A missing or unreadable file falls back to the defaults.
     */
    public ExportSettings loadSettingsFile(Path settingsFile) {
        if (!Files.exists(settingsFile)) {
            log.warn("Settings file not found: {}, using defaults", settingsFile);
            return ExportSettings.defaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            ExportSettings settings = mapper.readValue(settingsFile.toFile(), ExportSettings.class);
            if (settings == null) {
                log.warn("Settings file {} is empty, using defaults", settingsFile);
                return ExportSettings.defaults();
            }
            log.info("Loaded export settings from: {}", settingsFile);
            return settings;
        } catch (IOException e) {
            log.error("Failed to load settings from {}: {}, using defaults", settingsFile, e.getMessage());
            return ExportSettings.defaults();
        }
    }

    private void applyEnvironmentVariables(ExportSettings settings) {
        if (environment.containsKey(ENV_WRAP_WIDTH)) {
            try {
                settings.setWrapWidth(Integer.parseInt(environment.get(ENV_WRAP_WIDTH).trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", ENV_WRAP_WIDTH, environment.get(ENV_WRAP_WIDTH));
            }
        }
        if (environment.containsKey(ENV_OUTPUT_CALLEES)) {
            settings.setOutputCallees(splitNames(environment.get(ENV_OUTPUT_CALLEES)));
        }
        if (environment.containsKey(ENV_INPUT_CALLEES)) {
            settings.setInputCallees(splitNames(environment.get(ENV_INPUT_CALLEES)));
        }
    }

    private void applyCLIArguments(ExportSettings settings, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--export.wrap-width":
                        settings.setWrapWidth(Integer.parseInt(value));
                        break;
                    case "--export.output-callees":
                        settings.setOutputCallees(splitNames(value));
                        break;
                    case "--export.input-callees":
                        settings.setInputCallees(splitNames(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private static List<String> splitNames(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Returns help text for export settings options.
     */
    public static String getSettingsHelp() {
        return """
            Export Settings Options:

            CLI Arguments:
              --settings <file>                  YAML file with export settings
              --export.wrap-width <num>          Column width for wrapping node labels (default: 30)
              --export.output-callees <a,b>      Call names drawn as output nodes
              --export.input-callees <a,b>       Call names drawn as input nodes

            Environment Variables:
              CFGAUDIT_WRAP_WIDTH                Same as --export.wrap-width
              CFGAUDIT_OUTPUT_CALLEES            Same as --export.output-callees
              CFGAUDIT_INPUT_CALLEES             Same as --export.input-callees

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Built-in defaults
            """;
    }
}

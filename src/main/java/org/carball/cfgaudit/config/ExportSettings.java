package org.carball.cfgaudit.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.cfgaudit.analyzer.CallClassifier;
import org.carball.cfgaudit.output.LabelWrapper;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tunables for node classification and graph export. Loaded from YAML with snake_case keys.
 */
@Data
@Slf4j
public class ExportSettings {

    @JsonProperty("wrap_width")
    private int wrapWidth = LabelWrapper.DEFAULT_WIDTH;

    @JsonProperty("output_callees")
    private List<String> outputCallees = defaultOutputCallees();

    @JsonProperty("input_callees")
    private List<String> inputCallees = defaultInputCallees();

    public static ExportSettings defaults() {
        return new ExportSettings();
    }

    private static List<String> defaultOutputCallees() {
        return new ArrayList<>(List.of("print", "printf", "println"));
    }

    private static List<String> defaultInputCallees() {
        return new ArrayList<>(List.of("input", "nextline", "readline", "scanf"));
    }

    // A key present without a value arrives as null; keep the default instead.
    @JsonProperty("wrap_width")
    public void setWrapWidth(Integer wrapWidth) {
        if (wrapWidth == null) {
            log.warn("No value given for wrap_width, keeping {}", this.wrapWidth);
            return;
        }
        this.wrapWidth = wrapWidth;
    }

    @JsonProperty("output_callees")
    public void setOutputCallees(List<String> outputCallees) {
        if (outputCallees == null) {
            log.warn("No value given for output_callees, using defaults");
            this.outputCallees = defaultOutputCallees();
            return;
        }
        this.outputCallees = outputCallees;
    }

    @JsonProperty("input_callees")
    public void setInputCallees(List<String> inputCallees) {
        if (inputCallees == null) {
            log.warn("No value given for input_callees, using defaults");
            this.inputCallees = defaultInputCallees();
            return;
        }
        this.inputCallees = inputCallees;
    }

    @JsonIgnore
    public CallClassifier getCallClassifier() {
        return new CallClassifier(outputCallees, inputCallees);
    }

    @JsonIgnore
    public LabelWrapper getLabelWrapper() {
        return new LabelWrapper(wrapWidth);
    }

    /**
     * Validates the settings and logs warnings for values that are accepted but probably not intended.
     */
    public void validate() {
        if (wrapWidth < 1) {
            throw new IllegalArgumentException("Wrap width must be positive: " + wrapWidth);
        }

        if (wrapWidth < 10) {
            log.warn("Wrap width ({}) is very small, labels will break after nearly every word", wrapWidth);
        }

        if (outputCallees.isEmpty() && inputCallees.isEmpty()) {
            log.warn("No input or output callees configured, every call will be drawn as a plain call");
        }

        Set<String> overlap = new HashSet<>(outputCallees);
        overlap.retainAll(inputCallees);
        if (!overlap.isEmpty()) {
            log.warn("Callees {} are listed as both output and input, output wins", overlap);
        }

        log.debug("Using export settings - wrap width: {}, output callees: {}, input callees: {}",
                wrapWidth, outputCallees, inputCallees);
    }

    @JsonIgnore
    public String getConfigurationSummary() {
        return String.format("Wrap width: %d | Output callees: %s | Input callees: %s",
                wrapWidth, String.join(",", outputCallees), String.join(",", inputCallees));
    }
}

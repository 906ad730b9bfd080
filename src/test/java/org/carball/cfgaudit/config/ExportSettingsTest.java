package org.carball.cfgaudit.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.cfgaudit.model.graph.NodeKind;
import org.carball.cfgaudit.model.statement.CallExpression;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExportSettingsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ExportSettings.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldValidateDefaultsWithoutWarnings() {
        // When
        ExportSettings.defaults().validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .isEmpty();
    }

    @Test
    void shouldWarnAboutTinyWrapWidth() {
        // Given
        ExportSettings settings = ExportSettings.defaults();
        settings.setWrapWidth(5);

        // When
        settings.validate();

        // Then
        assertThat(warnings()).anyMatch(message -> message.contains("very small"));
    }

    @Test
    void shouldWarnAboutCalleesListedTwice() {
        // Given
        ExportSettings settings = ExportSettings.defaults();
        settings.setInputCallees(new ArrayList<>(List.of("print", "input")));

        // When
        settings.validate();

        // Then
        assertThat(warnings()).anyMatch(message -> message.contains("listed as both output and input"));
    }

    @Test
    void shouldWarnWhenNoCalleesAreConfigured() {
        // Given
        ExportSettings settings = ExportSettings.defaults();
        settings.setOutputCallees(new ArrayList<>());
        settings.setInputCallees(new ArrayList<>());

        // When
        settings.validate();

        // Then
        assertThat(warnings()).anyMatch(message -> message.contains("No input or output callees"));
    }

    @Test
    void shouldBuildClassifierAndWrapperFromSettings() {
        // Given
        ExportSettings settings = ExportSettings.defaults();
        settings.setWrapWidth(12);
        settings.setOutputCallees(new ArrayList<>(List.of("Emit")));

        // Then
        assertThat(settings.getLabelWrapper().getWidth()).isEqualTo(12);
        assertThat(settings.getCallClassifier().classify(CallExpression.of("bus.emit", "bus.emit(e)")))
                .isEqualTo(NodeKind.OUTPUT);
        assertThat(settings.getCallClassifier().classify(CallExpression.of("print", "print(e)")))
                .isEqualTo(NodeKind.CALL);
        assertThat(settings.getConfigurationSummary()).contains("Wrap width: 12");
    }

    private List<String> warnings() {
        return logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }
}

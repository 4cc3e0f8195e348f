package ai.docsite.corpus.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.corpus.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void restoreTestConfiguration() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
        root.setLevel(Level.WARN);
    }

    @Test
    void switchesConsoleAppenderToJsonLayout() {
        LoggingConfigurator.configure(LogFormat.JSON, true);

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(consoleAppender().getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) consoleAppender().getEncoder()).getLayout())
                .isInstanceOf(SimpleJsonLayout.class);
        assertThat(consoleAppender().isStarted()).isTrue();
    }

    @Test
    void textFormatUsesPatternEncoderAtInfo() {
        LoggingConfigurator.configure(LogFormat.JSON, false);
        LoggingConfigurator.configure(LogFormat.TEXT, false);

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(consoleAppender().getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
    }

    private OutputStreamAppender<ILoggingEvent> consoleAppender() {
        return (OutputStreamAppender<ILoggingEvent>) root.getAppender("CONSOLE");
    }
}

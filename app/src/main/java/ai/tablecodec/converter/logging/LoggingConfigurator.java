package ai.tablecodec.converter.logging;

import ai.tablecodec.converter.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches the encoders of every stream appender attached to a logback context between text and JSON output.
 */
public final class LoggingConfigurator {

    static final String TEXT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} %X{conversion} - %msg%n";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * Applies {@code format} to the active logback context. Does nothing when another SLF4J binding is in use.
     */
    public static int configure(LogFormat format) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            LOGGER.debug("Logging backend {} is not logback; leaving format unchanged", factory.getClass().getName());
            return 0;
        }
        return configure(format, context);
    }

    /**
     * Applies {@code format} to every output stream appender in {@code context}, returning how many were updated.
     */
    public static int configure(LogFormat format, LoggerContext context) {
        Map<Appender<ILoggingEvent>, Boolean> seen = new IdentityHashMap<>();
        for (Logger logger : context.getLoggerList()) {
            for (Iterator<Appender<ILoggingEvent>> it = logger.iteratorForAppenders(); it.hasNext(); ) {
                Appender<ILoggingEvent> appender = it.next();
                if (seen.put(appender, Boolean.TRUE) == null
                        && appender instanceof OutputStreamAppender<ILoggingEvent> streamAppender) {
                    swapEncoder(streamAppender, newEncoder(format, context));
                }
            }
        }
        int updated = (int) seen.keySet().stream().filter(OutputStreamAppender.class::isInstance).count();
        LOGGER.debug("Applied {} log format to {} appender(s)", format, updated);
        return updated;
    }

    private static Encoder<ILoggingEvent> newEncoder(LogFormat format, LoggerContext context) {
        return switch (format) {
            case JSON -> {
                JsonLogLayout layout = new JsonLogLayout();
                layout.setContext(context);
                layout.start();
                LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
                encoder.setContext(context);
                encoder.setLayout(layout);
                encoder.start();
                yield encoder;
            }
            case TEXT -> {
                PatternLayoutEncoder encoder = new PatternLayoutEncoder();
                encoder.setContext(context);
                encoder.setPattern(TEXT_PATTERN);
                encoder.start();
                yield encoder;
            }
        };
    }

    private static void swapEncoder(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}

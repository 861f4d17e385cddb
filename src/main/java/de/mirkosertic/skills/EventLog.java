package de.mirkosertic.skills;

import ch.qos.logback.classic.LoggerContext;
import de.mirkosertic.skills.config.BuildInfo;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.spi.LoggingEventBuilder;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Map;

/**
 * Structured event log handle.
 * <p>
 * Created once by the entry point and handed to the components that emit events. {@link #start()}
 * installs the global context (application, version, host) into the MDC and {@link #stop()}
 * removes it again and flushes the logging backend. Events are emitted through the SLF4J fluent
 * API, so every payload entry becomes a key-value pair of the logging event.
 */
public class EventLog {

    private static final Logger logger = LoggerFactory.getLogger(EventLog.class);

    static final String APP_NAME = "skills-indexer";

    private final Logger eventLogger;
    private volatile boolean started;

    public EventLog() {
        this(LoggerFactory.getLogger("de.mirkosertic.skills.events"));
    }

    EventLog(final Logger eventLogger) {
        this.eventLogger = eventLogger;
    }

    public void start() {
        if (started) {
            return;
        }
        MDC.put("app", APP_NAME);
        MDC.put("version", BuildInfo.version());
        MDC.put("host", hostName());
        started = true;
        logger.debug("Event log started");
    }

    public void stop() {
        if (!started) {
            return;
        }
        logger.debug("Event log stopping");
        MDC.remove("app");
        MDC.remove("version");
        MDC.remove("host");
        started = false;

        final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            context.stop();
        }
    }

    public boolean isStarted() {
        return started;
    }

    public void info(final String event, final Map<String, ?> payload) {
        emit(eventLogger.atInfo(), event, payload);
    }

    public void warn(final String event, final Map<String, ?> payload) {
        emit(eventLogger.atWarn(), event, payload);
    }

    public void error(final String event, final Map<String, ?> payload, final Throwable cause) {
        emit(eventLogger.atError().setCause(cause), event, payload);
    }

    private void emit(final LoggingEventBuilder builder, final String event, final Map<String, ?> payload) {
        LoggingEventBuilder current = builder.addKeyValue("event", event);
        for (final Map.Entry<String, ?> entry : payload.entrySet()) {
            current = current.addKeyValue(entry.getKey(), entry.getValue());
        }
        current.log(event);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            return "unknown";
        }
    }
}

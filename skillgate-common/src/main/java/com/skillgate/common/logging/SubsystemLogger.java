package com.skillgate.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.util.Map;

/**
 * SLF4J wrapper that tags every line with a subsystem name ("skills",
 * "tools/policy", ...) and renders structured metadata as a trailing
 * {@code {key=value}} block.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("skills");
 * log.warn("tool excluded", Map.of("skillName", "chef", "toolName", "exec"));
 * </pre>
 *
 * The SLF4J logger name is {@code skillgate.<subsystem>}, so levels can be
 * tuned per subsystem in logback.xml. The subsystem is also exposed through
 * the {@code subsystem} MDC key while the line is emitted.
 */
public class SubsystemLogger {

    static final String MDC_SUBSYSTEM = "subsystem";
    private static final String LOGGER_PREFIX = "skillgate.";

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger(LOGGER_PREFIX + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Child logger with an extended subsystem path ({@code parent/name}).
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    public void trace(String message) {
        emit(Level.TRACE, message, null);
    }

    public void debug(String message) {
        emit(Level.DEBUG, message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(Level.DEBUG, message, meta);
    }

    public void info(String message) {
        emit(Level.INFO, message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(Level.INFO, message, meta);
    }

    public void warn(String message) {
        emit(Level.WARN, message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(Level.WARN, message, meta);
    }

    public void error(String message, Throwable t) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            logger.error(formatMessage(message, null), t);
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    public String getSubsystem() {
        return subsystem;
    }

    private void emit(Level level, String message, Map<String, Object> meta) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            switch (level) {
                case TRACE -> {
                    if (logger.isTraceEnabled())
                        logger.trace(formatMessage(message, meta));
                }
                case DEBUG -> {
                    if (logger.isDebugEnabled())
                        logger.debug(formatMessage(message, meta));
                }
                case INFO -> logger.info(formatMessage(message, meta));
                case WARN -> logger.warn(formatMessage(message, meta));
                case ERROR -> logger.error(formatMessage(message, meta));
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(subsystem).append("] ").append(message);
        if (meta == null || meta.isEmpty()) {
            return sb.toString();
        }
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        sb.append('}');
        return sb.toString();
    }
}

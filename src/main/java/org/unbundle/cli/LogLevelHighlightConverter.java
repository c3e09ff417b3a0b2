package org.unbundle.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the level column of console output: errors red, warnings yellow, info cyan and
 * debug/trace dimmed. Registered in {@code logback.xml} as {@code %levelColor(...)}.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String CYAN = "\u001B[36m";
    private static final String DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String color = colorOf(event.getLevel());
        return color == null ? in : color + in + RESET;
    }

    static String colorOf(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> RED;
            case Level.WARN_INT -> YELLOW;
            case Level.INFO_INT -> CYAN;
            case Level.DEBUG_INT, Level.TRACE_INT -> DIM;
            default -> null;
        };
    }
}

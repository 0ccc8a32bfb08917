package dumb.smt.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Log {

    private static final Logger logger = LoggerFactory.getLogger("dumb.smt");

    public static void error(String message) {
        message(message, LogLevel.ERROR);
    }

    public static void warning(String message) {
        message(message, LogLevel.WARNING);
    }

    public static void message(String message, LogLevel level) {
        switch (level) {
            case WARNING -> logger.warn(message);
            case ERROR -> logger.error(message);
        }
    }

    /** Diagnostic trace; arguments are only rendered when debug output is enabled. */
    public static void debug(String pattern, Object... args) {
        logger.debug(pattern, args);
    }

    public static boolean debugging() {
        return logger.isDebugEnabled();
    }

    public enum LogLevel {
        WARNING, ERROR
    }
}

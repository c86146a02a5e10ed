package alpha.pathrouter.testutil;

import org.assertj.core.groups.Tuple;

import java.util.logging.LogRecord;

import static java.lang.System.Logger.Level;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Utils for JUL's {@link LogRecord} and related types.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    /**
     * Create an AssertJ Tuple consisting of a log- level and message.
     * 
     * @param level of log record
     * @param msg of log record
     * @return a tuple
     * 
     * @throws NullPointerException
     *             if {@code level} is {@code null}
     */
    public static Tuple rec(Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Convert {@code System.Logger.Level} to {@code java.util.logging.Level}.<p>
     * 
     * The mapping is the one used by the JDK's default {@code System.Logger}
     * implementation.
     *
     * @param level to convert
     * @return the converted value
     * @throws NullPointerException if {@code level} is {@code null}
     */
    static java.util.logging.Level toJUL(Level level) {
        requireNonNull(level);
        return switch (level) {
            case ALL     -> java.util.logging.Level.ALL;
            case TRACE   -> java.util.logging.Level.FINER;
            case DEBUG   -> java.util.logging.Level.FINE;
            case INFO    -> java.util.logging.Level.INFO;
            case WARNING -> java.util.logging.Level.WARNING;
            case ERROR   -> java.util.logging.Level.SEVERE;
            case OFF     -> java.util.logging.Level.OFF;
        };
    }
    
    /**
     * Returns a string of the record's level and message.<p>
     * 
     * {@code LogRecord} does not implement {@code toString} and would return
     * something like "java.util.logging.LogRecord@4e196770".
     * 
     * @param rec log record to format
     * @return a string
     */
    public static String toString(LogRecord rec) {
        return rec.getLevel() + " | " + rec.getLoggerName() + " | " + rec.getMessage();
    }
}

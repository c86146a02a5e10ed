package alpha.pathrouter.testutil;

import alpha.pathrouter.Config;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.stream.Stream;

import static alpha.pathrouter.testutil.LogRecords.rec;
import static alpha.pathrouter.testutil.LogRecords.toJUL;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Stream.of;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * A utility for asserting log records.<p>
 *
 * Many methods in this class accept predicate arguments for matching a record.
 * Each observed record's values are compared with the arguments accordingly:
 *
 * <ul>
 *   <li>{@code getLevel()} must be equal to {@code level}
 *   <li>{@code getMessage()} must be equal to {@code message}
 *   <li>{@code getMessage().}{@link String#startsWith(String) startsWith}{@code ()}
 *       must return {@code true} given {@code messageStartsWith}
 * </ul>
 *
 * Methods with an "assert" prefix throws an {@code AssertionError} if the
 * record can not be found.<p>
 *
 * Methods with "remove" in their name will remove the earliest record which is
 * a match, meaning that the matched record will not be matched again. The
 * purpose is to limit subsequent assertions to what is left behind.<p>
 *
 * For example:
 * <pre>{@code
 *     // The test provoked an expected record...
 *     recorder.assertRemove(DEBUG, "Route \"GET /a\" replaced")
 *     // ...but no other record on level DEBUG or above is expected
 *             .assertNothingAbove(TRACE);
 * }</pre>
 *
 * Create a log recorder using {@link #startRecording()}. Recording sets the
 * level of the targeted loggers to {@code ALL}, so that no record is filtered
 * out before reaching the recorder. {@link #stopRecording()} restores the
 * previous levels.
 */
public final class LogRecorder
{
    /**
     * Starts recording all log records of the library.<p>
     *
     * An invocation of this method behaves in exactly the same way as the
     * invocation
     * <pre>
     *     LogRecorder.{@link #startRecording(Class, Class[])
     *       startRecording}(Config.class);
     * </pre>
     *
     * @return a new log recorder
     */
    public static LogRecorder startRecording() {
        return startRecording(Config.class);
    }
    
    /**
     * Starts recording log records from the loggers of the packages that the
     * given components belong to.<p>
     *
     * Recording should eventually be stopped using {@link #stopRecording()}.
     *
     * @param firstComponent at least one
     * @param more may be provided
     *
     * @return a new log recorder
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static LogRecorder startRecording(Class<?> firstComponent, Class<?>... more) {
        RecordHandler[] h = Stream.concat(of(firstComponent), of(more))
                .map(c -> {
                    var rh = new RecordHandler(c,
                            Logging.setLevel(c, System.Logger.Level.ALL));
                    Logging.addHandler(c, rh);
                    return rh;
                }).toArray(RecordHandler[]::new);
    
        return new LogRecorder(h);
    }
    
    private final RecordHandler[] handlers;
    
    private LogRecorder(RecordHandler[] handlers) {
        this.handlers = handlers;
    }
    
    /**
     * Returns all records observed so far, in the order they were published.
     *
     * @return all records (unmodifiable)
     */
    public List<LogRecord> records() {
        return recordsStream().toList();
    }
    
    /**
     * Removes the matched record.
     *
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     *
     * @see LogRecorder
     */
    public LogRecorder assertRemove(
            System.Logger.Level level, String messageStartsWith) {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith),
                level + " " + messageStartsWith);
        return this;
    }
    
    /**
     * Asserts that only one record has the given values.
     *
     * @param level record's level predicate
     * @param message record's message predicate
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if not exactly one record is found
     */
    public LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        assertThat(records())
            .extracting(
                LogRecord::getLevel,
                LogRecord::getMessage)
            .containsOnlyOnce(rec(level, message));
        return this;
    }
    
    /**
     * Asserts that no record has a level greater than the one given.
     *
     * @param level max level allowed
     *
     * @return this for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code level} is {@code null}
     * @throws AssertionError
     *             if a record has a greater level
     */
    public LogRecorder assertNothingAbove(System.Logger.Level level) {
        final int max = toJUL(level).intValue();
        assertThat(records())
            .as(this::describe)
            .noneMatch(r -> r.getLevel().intValue() > max);
        return this;
    }
    
    /**
     * Asserts that no record has a throwable nor a level greater than
     * {@code INFO}.
     *
     * @return this for chaining/fluency
     *
     * @throws AssertionError
     *             if a record has a throwable
     *             or a level greater than {@code INFO}
     */
    public LogRecorder assertNoProblem() {
        assertThat(records())
            .as(this::describe)
            .noneMatch(v -> v.getLevel().intValue() > Level.INFO.intValue())
            .noneMatch(v -> v.getThrown() != null);
        return this;
    }
    
    /**
     * Stop recording log records.<p>
     *
     * The levels of the loggers are restored.
     */
    public void stopRecording() {
        handlers().forEach(h -> {
            Logging.removeHandler(h.component(), h);
            Logging.restoreLevel(h.component(), h.levelBefore());
        });
    }
    
    private Stream<RecordHandler> handlers() {
        return Stream.of(handlers);
    }
    
    private Stream<LogRecord> recordsStream() {
        return handlers().flatMap(h -> h.records().stream());
    }
    
    private String describe() {
        return recordsStream().map(LogRecords::toString)
                .collect(joining("\n", "Records:\n", ""));
    }
    
    /**
     * Removes the earliest record matching the given predicate.
     *
     * @param test record predicate
     * @param what description of the expected record
     *
     * @throws AssertionError
     *             if no record matched the predicate
     */
    private void assertRemoveIf(Predicate<LogRecord> test, String what) {
        for (var h : handlers) {
            var it = h.records().iterator();
            while (it.hasNext()) {
                if (test.test(it.next())) {
                    it.remove();
                    return;
                }
            }
        }
        throw new AssertionError("No record: " + what + "\n" + describe());
    }
    
    private static final class RecordHandler extends Handler {
        private final Class<?> cmp;
        private final Level before;
        private final Deque<LogRecord> deq;
    
        RecordHandler(Class<?> component, Level levelBefore) {
            cmp    = component;
            before = levelBefore;
            deq    = new ConcurrentLinkedDeque<>();
            super.setLevel(Level.ALL);
        }
    
        Class<?> component() {
            return cmp;
        }
    
        Level levelBefore() {
            return before;
        }
    
        Deque<LogRecord> records() {
            return deq;
        }
    
        @Override
        public void publish(LogRecord record) {
            deq.add(record);
        }
    
        @Override
        public void flush() {
            // Empty
        }
    
        @Override
        public void close() {
            // Empty
        }
    }
}

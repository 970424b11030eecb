package alpha.tinyhttp.testutil;

import org.assertj.core.api.AbstractThrowableAssert;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

/**
 * Collects the log records of the server's loggers.<p>
 *
 * Records are matched on level and on how the message starts. The
 * {@code assertRemove} methods consume the matched record, leaving
 * {@link #assertNoProblem()} to look at what no test case accounted for.
 */
public final class LogRecorder extends Handler
{
    private static final long AWAIT_NANOS = SECONDS.toNanos(3);

    /**
     * Start recording.
     *
     * @return a log recorder
     */
    public static LogRecorder startRecording() {
        var r = new LogRecorder();
        Logging.SERVER.addHandler(r);
        return r;
    }

    // Guarded by this
    private final List<LogRecord> records = new ArrayList<>();

    private LogRecorder() {
        setLevel(Level.ALL);
    }

    /**
     * Stop recording. Recorded records remain.
     */
    public void stopRecording() {
        Logging.SERVER.removeHandler(this);
    }

    @Override
    public synchronized void publish(LogRecord r) {
        records.add(r);
        notifyAll();
    }

    @Override
    public void flush() {
        // Nothing buffered
    }

    @Override
    public void close() {
        stopRecording();
    }

    /**
     * Remove a record, failing if there is none.
     *
     * @param level of record
     * @param messageStartsWith start of message
     * @return this
     */
    public LogRecorder assertRemove(System.Logger.Level level, String messageStartsWith) {
        take(matching(level, messageStartsWith), level + " " + messageStartsWith);
        return this;
    }

    /**
     * Remove a record with an error, failing if there is none.
     *
     * @param level of record
     * @param messageStartsWith start of message
     * @param error type of error
     * @return an assert of the error
     */
    public AbstractThrowableAssert<?, ? extends Throwable> assertRemove(
            System.Logger.Level level, String messageStartsWith,
            Class<? extends Throwable> error)
    {
        var r = take(matching(level, messageStartsWith).and(x -> error.isInstance(x.getThrown())),
                level + " " + messageStartsWith + " with " + error.getSimpleName());
        return assertThat(r.getThrown());
    }

    /**
     * Wait up to 3 seconds for a record, then remove it.
     *
     * @param level of record
     * @param messageStartsWith start of message
     * @return this
     * @throws InterruptedException if interrupted while waiting
     */
    public synchronized LogRecorder assertAwaitRemove(
            System.Logger.Level level, String messageStartsWith)
            throws InterruptedException
    {
        var test = matching(level, messageStartsWith);
        final long deadline = System.nanoTime() + AWAIT_NANOS;
        while (records.stream().noneMatch(test)) {
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                fail("Timed out awaiting " + level + " " + messageStartsWith);
            }
            wait(NANOSECONDS.toMillis(left) + 1);
        }
        return assertRemove(level, messageStartsWith);
    }

    /**
     * Assert that no record is above {@code INFO} or carries an error.
     *
     * @return this
     */
    public synchronized LogRecorder assertNoProblem() {
        assertThat(records)
                .noneMatch(r -> r.getLevel().intValue() > Level.INFO.intValue())
                .noneMatch(r -> r.getThrown() != null);
        return this;
    }

    /**
     * Assert that exactly one record has the given level and message.
     *
     * @param level of record
     * @param message of record, in full
     * @return this
     */
    public synchronized LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        var jul = Logging.toJul(level);
        assertThat(records)
                .filteredOn(r -> r.getLevel().equals(jul) && message.equals(r.getMessage()))
                .hasSize(1);
        return this;
    }

    private static Predicate<LogRecord> matching(System.Logger.Level level, String messageStartsWith) {
        var jul = Logging.toJul(level);
        return r -> r.getLevel().equals(jul) &&
                    r.getMessage() != null &&
                    r.getMessage().startsWith(messageStartsWith);
    }

    private synchronized LogRecord take(Predicate<LogRecord> test, String what) {
        for (var it = records.iterator(); it.hasNext(); ) {
            var r = it.next();
            if (test.test(r)) {
                it.remove();
                return r;
            }
        }
        return fail("No record: " + what + ". Have: " + records.stream()
                .map(r -> r.getLevel() + " " + r.getMessage()).toList());
    }
}

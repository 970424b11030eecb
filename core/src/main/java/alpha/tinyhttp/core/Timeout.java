package alpha.tinyhttp.core;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Schedules an action to run after a timeout, unless aborted before then.<p>
 *
 * All instances share one daemon thread. The action is expected to be quick,
 * e.g. closing a channel.<p>
 *
 * An instance can be scheduled once at a time.
 */
final class Timeout
{
    private static final ScheduledThreadPoolExecutor SCHEDULER;

    static {
        (SCHEDULER = new ScheduledThreadPoolExecutor(1,
                new DaemonThreadFactory())).
                setRemoveOnCancelPolicy(true);
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("TinyHttpTimeout");
            return t;
        }
    }

    private final long nanos;
    private ScheduledFuture<?> task;
    private long generation;

    Timeout(Duration timeout) {
        this.nanos = timeout.toNanos();
    }

    /**
     * Schedule an action to run after the timeout.
     *
     * @param action to run
     * @throws IllegalStateException if already scheduled
     */
    synchronized void schedule(Runnable action) {
        requireNonNull(action);
        if (task != null) {
            throw new IllegalStateException("Already scheduled");
        }
        final long gen = ++generation;
        task = SCHEDULER.schedule(() -> {
            synchronized (this) {
                if (gen != generation || task == null) {
                    // Aborted
                    return;
                }
                task = null;
            }
            action.run();
        }, nanos, NANOSECONDS);
    }

    /**
     * Abort the scheduled action, if it has not already begun.<p>
     *
     * When this method returns, the action will not begin. It may still be
     * running if it started before this call.
     */
    synchronized void abort() {
        ++generation;
        if (task != null) {
            // Only to clean up the scheduler's work queue
            task.cancel(false);
            task = null;
        }
    }
}

package alpha.tinyhttp.testutil;

import alpha.tinyhttp.HttpServer;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

/**
 * Logging setup of tests.<p>
 *
 * The server logs through {@code System.Logger}, which the JDK routes to
 * {@code java.util.logging}. All loggers of the server share the parent
 * {@link #SERVER}, named after the base package.
 */
public final class Logging {
    private Logging() {
        // Empty
    }

    /**
     * Parent logger of all server components.<p>
     *
     * Held strongly, or else JUL could collect it and forget its level.
     */
    static final Logger SERVER = Logger.getLogger(HttpServer.class.getPackageName());

    private static final AtomicBoolean CONSOLE = new AtomicBoolean();

    /**
     * Enable all levels of the server's loggers, and print records on
     * {@code System.out}, one line each.<p>
     *
     * The records no longer reach the root logger's console handler on
     * {@code System.err}.
     */
    public static void everything() {
        SERVER.setLevel(Level.ALL);
        if (CONSOLE.compareAndSet(false, true)) {
            var out = new StreamHandler(System.out, new OneLiner()) {
                @Override
                public synchronized void publish(LogRecord r) {
                    super.publish(r);
                    flush();
                }
            };
            out.setLevel(Level.ALL);
            SERVER.addHandler(out);
            SERVER.setUseParentHandlers(false);
        }
    }

    /**
     * Maps a {@code System.Logger} level the same way the JDK's JUL bridge
     * does.
     *
     * @param level to map
     * @return the JUL level
     */
    static Level toJul(System.Logger.Level level) {
        switch (level) {
            case ALL:     return Level.ALL;
            case TRACE:   return Level.FINER;
            case DEBUG:   return Level.FINE;
            case INFO:    return Level.INFO;
            case WARNING: return Level.WARNING;
            case ERROR:   return Level.SEVERE;
            case OFF:     return Level.OFF;
            default:
                throw new IllegalArgumentException(level.name());
        }
    }

    /**
     * {@code 12:00:00.042 [TinyHttpWorker-1] FINE alpha.tinyhttp.core: message}
     */
    private static final class OneLiner extends Formatter {
        private static final DateTimeFormatter TIME =
                DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

        @Override
        public String format(LogRecord r) {
            var line = new StringBuilder()
                    .append(TIME.format(r.getInstant()))
                    .append(" [").append(Thread.currentThread().getName()).append("] ")
                    .append(r.getLevel().getName()).append(' ')
                    .append(r.getLoggerName()).append(": ")
                    .append(formatMessage(r))
                    .append('\n');
            if (r.getThrown() != null) {
                var trace = new StringWriter();
                r.getThrown().printStackTrace(new PrintWriter(trace, true));
                line.append(trace);
            }
            return line.toString();
        }
    }
}

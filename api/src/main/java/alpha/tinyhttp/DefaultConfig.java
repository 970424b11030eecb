package alpha.tinyhttp;

import alpha.tinyhttp.util.AbstractImmutableBuilder;

import java.time.Duration;
import java.util.function.Consumer;

import static java.lang.Math.max;
import static java.time.Duration.ofSeconds;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder  builder;
    private final int      maxRequestSize,
                           workerThreads,
                           maxQueuedConnections;
    private final Duration timeoutRead,
                           timeoutWrite;

    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder              = b;
        maxRequestSize       = s.maxRequestSize;
        workerThreads        = s.workerThreads;
        maxQueuedConnections = s.maxQueuedConnections;
        timeoutRead          = s.timeoutRead;
        timeoutWrite         = s.timeoutWrite;
    }

    @Override
    public int maxRequestSize() {
        return maxRequestSize;
    }

    @Override
    public int workerThreads() {
        return workerThreads;
    }

    @Override
    public int maxQueuedConnections() {
        return maxQueuedConnections;
    }

    @Override
    public Duration timeoutRead() {
        return timeoutRead;
    }

    @Override
    public Duration timeoutWrite() {
        return timeoutWrite;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + '{' + String.join(", ",
                "maxRequestSize=" + maxRequestSize,
                "workerThreads=" + workerThreads,
                "maxQueuedConnections=" + maxQueuedConnections,
                "timeoutRead=" + timeoutRead,
                "timeoutWrite=" + timeoutWrite) + '}';
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();

        static class MutableState {
            int      maxRequestSize       = 8_192,
                     workerThreads        = max(4, 2 * Runtime.getRuntime().availableProcessors()),
                     maxQueuedConnections = 100;
            Duration timeoutRead          = ofSeconds(30),
                     timeoutWrite         = timeoutRead;
        }

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Builder maxRequestSize(int newVal) {
            requirePositive(newVal);
            return new DefaultBuilder(this, s -> s.maxRequestSize = newVal);
        }

        @Override
        public Builder workerThreads(int newVal) {
            requirePositive(newVal);
            return new DefaultBuilder(this, s -> s.workerThreads = newVal);
        }

        @Override
        public Builder maxQueuedConnections(int newVal) {
            requirePositive(newVal);
            return new DefaultBuilder(this, s -> s.maxQueuedConnections = newVal);
        }

        @Override
        public Builder timeoutRead(Duration newVal) {
            requirePositive(newVal);
            return new DefaultBuilder(this, s -> s.timeoutRead = newVal);
        }

        @Override
        public Builder timeoutWrite(Duration newVal) {
            requirePositive(newVal);
            return new DefaultBuilder(this, s -> s.timeoutWrite = newVal);
        }

        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }

        private static void requirePositive(int v) {
            if (v < 1) {
                throw new IllegalArgumentException("Must be positive: " + v);
            }
        }

        private static void requirePositive(Duration d) {
            if (requireNonNull(d).isNegative() || d.isZero()) {
                throw new IllegalArgumentException("Must be positive: " + d);
            }
        }
    }
}

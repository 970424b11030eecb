package alpha.tinyhttp;

import alpha.tinyhttp.message.MaxRequestSizeException;
import alpha.tinyhttp.message.Responses;

import java.time.Duration;

/**
 * Server configuration.<p>
 *
 * {@link Config#toBuilder()} allows for any configuration object to be used as
 * a template for a new instance.<p>
 *
 * The static method {@link #configuration()} is a shortcut for
 * {@code Config.DEFAULT.toBuilder()}:
 *
 * <pre>{@code
 *   HttpServer.create(configuration()
 *           .workerThreads(4)
 *           .timeoutRead(Duration.ofSeconds(5))
 *           .build());
 * }</pre>
 *
 * @implSpec
 * The implementation is immutable.
 */
public interface Config
{
    /**
     * Values used by {@link HttpServer#create(alpha.tinyhttp.handler.ExceptionHandler...)}.<p>
     *
     * This instance contains the following values:<p>
     *
     * Max request size = 8 192<br>
     * Worker threads = 2 x available processors, at least 4<br>
     * Max queued connections = 100<br>
     * Timeout read = 30 seconds<br>
     * Timeout write = 30 seconds
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * {@return the max number of bytes of a request, head and body included}<p>
     *
     * The server allocates one buffer of this size for each connection and
     * reads the request into it. If the request declares, or turns out to
     * have, more bytes than what fits, a {@link MaxRequestSizeException} is
     * thrown, which by default gets translated to a 413 (Payload Too Large)
     * response.<p>
     *
     * The {@link #DEFAULT} configuration returns 8 192.
     */
    int maxRequestSize();

    /**
     * {@return the number of threads processing connections}<p>
     *
     * Each accepted connection is processed in full by one worker thread.
     * This value is therefore also the max number of connections processed
     * concurrently.<p>
     *
     * The {@link #DEFAULT} configuration returns twice the number of available
     * processors, but never less than 4.
     */
    int workerThreads();

    /**
     * {@return the max number of accepted connections waiting for a worker}<p>
     *
     * When all workers are busy and this many connections are already waiting,
     * a newly accepted connection is rejected with a
     * {@link Responses#serviceUnavailable() 503 (Service Unavailable)} response
     * written by the thread accepting connections, and then closed.<p>
     *
     * The {@link #DEFAULT} configuration returns 100.
     */
    int maxQueuedConnections();

    /**
     * {@return the max duration allowed for receiving a request}<p>
     *
     * The timer starts when a worker begins processing the connection and
     * stops when a request has been read. On timeout, the connection is
     * closed without a response.<p>
     *
     * The {@link #DEFAULT} configuration returns 30 seconds.
     */
    Duration timeoutRead();

    /**
     * {@return the max duration allowed for writing a response}<p>
     *
     * On timeout, the connection is closed.<p>
     *
     * The {@link #DEFAULT} configuration returns 30 seconds.
     */
    Duration timeoutWrite();

    /**
     * Returns a builder pre-populated with the values of this instance.<p>
     *
     * The builder can be used to build a new configuration object with
     * different values, using this instance as a template.
     *
     * @return a builder
     */
    Builder toBuilder();

    /**
     * {@return a builder pre-populated with the values of {@link #DEFAULT}}
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Builder of {@link Config}.<p>
     *
     * The builder is immutable. All setter methods return a new builder
     * instance.
     */
    interface Builder {
        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal < 1}
         * @see Config#maxRequestSize()
         */
        Builder maxRequestSize(int newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal < 1}
         * @see Config#workerThreads()
         */
        Builder workerThreads(int newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal < 1}
         * @see Config#maxQueuedConnections()
         */
        Builder maxQueuedConnections(int newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @throws IllegalArgumentException if {@code newVal} is not positive
         * @see Config#timeoutRead()
         */
        Builder timeoutRead(Duration newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @throws IllegalArgumentException if {@code newVal} is not positive
         * @see Config#timeoutWrite()
         */
        Builder timeoutWrite(Duration newVal);

        /**
         * Builds the configuration object.
         *
         * @return the configuration object
         */
        Config build();
    }
}

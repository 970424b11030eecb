package alpha.tinyhttp;

import alpha.tinyhttp.handler.ExceptionHandler;
import alpha.tinyhttp.handler.RequestHandler;
import alpha.tinyhttp.message.Responses;
import alpha.tinyhttp.route.Router;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.ServiceLoader;
import java.util.concurrent.Future;
import java.util.function.IntConsumer;

import static java.util.stream.Collectors.toList;

/**
 * Listens on a port for HTTP connections.<p>
 *
 * The server accepts connections, reads one request from each, resolves a
 * {@link RequestHandler} registered for the exact path of the request, writes
 * the response and closes the connection. There is no support for persistent
 * connections.<p>
 *
 * A trivial example:
 *
 * <pre>{@code
 *   HttpServer.create()
 *             .register("/", (req, rsp) -> rsp.setContent("Hello"))
 *             .start(8080);
 * }</pre>
 *
 * If no handler is registered for the request path, the server responds
 * {@link Responses#notFound()}. A request that can not be parsed is responded
 * "400 Bad Request", and a request larger than
 * {@link Config#maxRequestSize()} is responded "413 Payload Too Large". Both
 * of these, as well as exceptions thrown by a request handler, pass through
 * the chain of {@link ExceptionHandler}s given to the server at creation
 * time.
 *
 * <h2>Life cycle</h2>
 *
 * A server instance can not be recycled; it can start and stop only once.<p>
 *
 * The {@code start(...)} methods bind the listening socket and then run the
 * accept loop on the calling thread. They return normally once the server has
 * been stopped. {@link #startAsync()} runs the accept loop on a new thread and
 * returns a {@code Future} which completes once the server has been
 * stopped.<p>
 *
 * {@link #stop()} stops accepting new connections and waits for connections
 * already accepted to finish. {@link #kill()} closes everything at once.
 *
 * <h2>Threading model</h2>
 *
 * One thread accepts connections and hands each over to a bounded pool of
 * {@link Config#workerThreads()} worker threads. A worker processes a
 * connection from start to end. When all workers are busy, at most
 * {@link Config#maxQueuedConnections()} connections wait in a queue; beyond
 * that, the accepting thread itself responds
 * {@link Responses#serviceUnavailable()} and closes the connection.<p>
 *
 * All threads created by the server are daemon threads.
 */
public interface HttpServer extends Router
{
    /**
     * Create a server using {@linkplain Config#DEFAULT default values}.<p>
     *
     * The server will not listen on a port until it is started.
     *
     * @param exceptionHandlers ordered
     *
     * @return an instance of {@code HttpServer}
     *
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     */
    static HttpServer create(ExceptionHandler... exceptionHandlers) {
        return create(Config.DEFAULT, exceptionHandlers);
    }

    /**
     * Create a server.<p>
     *
     * The implementation is looked up using {@link ServiceLoader}. Exactly one
     * {@link HttpServerFactory} must be available.
     *
     * @param config of server
     * @param exceptionHandlers ordered
     *
     * @return an instance of {@code HttpServer}
     *
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     */
    static HttpServer create(Config config, ExceptionHandler... exceptionHandlers) {
        var loader = ServiceLoader.load(HttpServerFactory.class);
        var factories = loader.stream().collect(toList());
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config, exceptionHandlers);
    }

    /**
     * Listen for client connections on a system-picked port on the loopback
     * address.<p>
     *
     * The port is given to the consumer after the server has bound, and
     * before the accept loop starts.
     *
     * @param ofPort port consumer
     *
     * @throws NullPointerException
     *             if {@code ofPort} is {@code null}
     * @throws IllegalStateException
     *             if the server has already been started
     * @throws IOException
     *             if the listening socket can not be opened or bound
     */
    void start(IntConsumer ofPort) throws IOException;

    /**
     * Listen for client connections on a given port on the wildcard
     * address.
     *
     * @param port to use
     *
     * @throws IllegalStateException
     *             if the server has already been started
     * @throws IOException
     *             if the listening socket can not be opened or bound
     *
     * @see #start(SocketAddress)
     */
    default void start(int port) throws IOException {
        start(new InetSocketAddress(port));
    }

    /**
     * Listen for client connections on a given address.<p>
     *
     * This method blocks until the server stops.
     *
     * @param address to use
     *
     * @throws NullPointerException
     *             if {@code address} is {@code null}
     * @throws IllegalStateException
     *             if the server has already been started
     * @throws IOException
     *             if the listening socket can not be opened or bound
     */
    void start(SocketAddress address) throws IOException;

    /**
     * Listen for client connections on a system-picked port on the loopback
     * address, using a new thread for the accept loop.<p>
     *
     * The listening socket is bound before this method returns, so
     * {@link #getPort()} can be used immediately.
     *
     * @return a future which completes once the server has stopped
     *
     * @throws IllegalStateException
     *             if the server has already been started
     * @throws IOException
     *             if the listening socket can not be opened or bound
     */
    Future<Void> startAsync() throws IOException;

    /**
     * Stop the server gracefully, waiting at most 5 seconds for connections
     * in flight to finish.
     *
     * @throws InterruptedException
     *             if interrupted while waiting
     *
     * @see #stop(Duration)
     */
    default void stop() throws InterruptedException {
        stop(Duration.ofSeconds(5));
    }

    /**
     * Stop the server gracefully.<p>
     *
     * The server stops accepting new connections. Connections already accepted,
     * queued or in flight, are allowed to finish until the timeout elapses,
     * after which remaining workers are interrupted and their connections
     * closed.<p>
     *
     * This method is NOP if the server is not running.
     *
     * @param timeout max duration to wait for connections to finish
     *
     * @throws NullPointerException
     *             if {@code timeout} is {@code null}
     * @throws InterruptedException
     *             if interrupted while waiting
     */
    void stop(Duration timeout) throws InterruptedException;

    /**
     * Stop the server immediately.<p>
     *
     * The listening socket and all connections in flight are closed, and
     * workers are interrupted. This method does not wait for the workers to
     * terminate.<p>
     *
     * This method is NOP if the server is not running.
     */
    void kill();

    /**
     * Returns {@code true} if the server is running, otherwise
     * {@code false}.<p>
     *
     * The server is running from the moment the listening socket has been
     * bound, until a stop method has been called.
     *
     * @return {@code true} if the server is running
     */
    boolean isRunning();

    /**
     * Returns the server's configuration.
     *
     * @return the server's configuration (never {@code null})
     */
    Config getConfig();

    /**
     * Returns the socket address that the server is listening on.
     *
     * @return the socket address that the server is listening on
     *
     * @throws IllegalStateException
     *             if the server is not running
     */
    SocketAddress getLocalAddress();

    /**
     * Returns the port that the server is listening on.
     *
     * @return the port that the server is listening on
     *
     * @throws IllegalStateException
     *             if the server is not running
     */
    default int getPort() {
        return ((InetSocketAddress) getLocalAddress()).getPort();
    }

    /**
     * {@inheritDoc}
     *
     * @return this (for chaining/fluency)
     */
    @Override
    HttpServer register(String path, RequestHandler handler);
}

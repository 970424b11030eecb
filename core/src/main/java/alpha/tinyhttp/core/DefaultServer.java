package alpha.tinyhttp.core;

import alpha.tinyhttp.Config;
import alpha.tinyhttp.HttpServer;
import alpha.tinyhttp.handler.ExceptionHandler;
import alpha.tinyhttp.handler.RequestHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

import static alpha.tinyhttp.message.Responses.serviceUnavailable;
import static alpha.tinyhttp.util.Blah.runOrClose;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.net.InetAddress.getLoopbackAddress;
import static java.net.StandardSocketOptions.SO_REUSEADDR;
import static java.time.Instant.now;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * The default implementation of {@code HttpServer}.<p>
 *
 * The accept loop runs on the thread that starts the server (or a new thread,
 * if started using {@link #startAsync()}). Each accepted connection ("child")
 * is submitted to a bounded pool of worker threads, where a
 * {@link ConnectionHandler} processes it. If the pool's queue is full, the
 * accepting thread responds "503 Service Unavailable" and closes the
 * child.<p>
 *
 * When the server channel ("parent") closes, the accept loop ends. Depending
 * on how the server was stopped, the loop then waits for children in flight
 * to finish, or closes them immediately.
 */
public final class DefaultServer implements HttpServer
{
    private static final System.Logger LOG
            = System.getLogger(DefaultServer.class.getPackageName());

    private final Config config;
    private final DefaultRouter routes;
    private final List<ExceptionHandler> eh;
    private final Confined<ServerSocketChannel> parent;
    private final CountDownLatch terminated;
    private final Set<SocketChannel> children;
    private final ThreadPoolExecutor workers;
    // Set before the parent is closed; null means no graceful period
    private volatile Instant waitForChildren;

    /**
     * Constructs this object.
     *
     * @param config server configuration
     * @param eh exception handlers
     *
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     */
    public DefaultServer(Config config, ExceptionHandler... eh) {
        this.config     = requireNonNull(config);
        this.routes     = new DefaultRouter();
        this.eh         = List.of(eh);
        this.parent     = new Confined<>();
        this.terminated = new CountDownLatch(1);
        this.children   = ConcurrentHashMap.newKeySet();
        this.workers    = new ThreadPoolExecutor(
                config.workerThreads(), config.workerThreads(),
                0, MILLISECONDS,
                new ArrayBlockingQueue<>(config.maxQueuedConnections()),
                new WorkerThreadFactory());
        this.waitForChildren = null;
    }

    @Override
    public void start(IntConsumer ofPort) throws IOException {
        requireNonNull(ofPort);
        runAcceptLoop(openOrFail(loopBackSystemPickedPort()), ofPort);
    }

    @Override
    public void start(SocketAddress address) throws IOException {
        runAcceptLoop(openOrFail(requireNonNull(address)), null);
    }

    @Override
    public Future<Void> startAsync() throws IOException {
        final var fut = new CompletableFuture<Void>();
        final ServerSocketChannel ch = openOrFail(loopBackSystemPickedPort());
        var t = new Thread(() -> {
            try {
                runAcceptLoop(ch, null);
            } catch (Throwable e) {
                fut.completeExceptionally(e);
                return;
            }
            fut.complete(null);
        }, "TinyHttpAcceptor");
        t.setDaemon(true);
        runOrClose(t::start, ch);
        return fut;
    }

    private ServerSocketChannel openOrFail(SocketAddress addr) throws IOException {
        var ssc2 = parent.initThrowsX(() -> {
            var ssc1 = ServerSocketChannel.open();
            runOrClose(() -> {
                ssc1.setOption(SO_REUSEADDR, true);
                ssc1.bind(addr);
                LOG.log(INFO, () -> "Opened server channel: " + ssc1);
            }, ssc1);
            return ssc1;
        });
        if (ssc2 == null) {
            throw new IllegalStateException("Server has started once before");
        }
        return ssc2;
    }

    private void runAcceptLoop(ServerSocketChannel ch, IntConsumer ofPort) {
        try {
            if (ofPort != null) {
                ofPort.accept(getPort());
            }
            for (;;) {
                SocketChannel child;
                try {
                    child = ch.accept();
                } catch (ClosedChannelException e) {
                    LOG.log(DEBUG, "Server channel closed, accept loop ends.");
                    break;
                } catch (IOException e) {
                    if (!ch.isOpen()) {
                        break;
                    }
                    LOG.log(WARNING, "Failed to accept a connection, will continue.", e);
                    continue;
                }
                submit(child);
            }
        } finally {
            closeParent();
            join();
            terminated.countDown();
        }
    }

    private void submit(SocketChannel child) {
        children.add(child);
        LOG.log(DEBUG, () -> "Accepted child: " + child);
        try {
            workers.execute(() -> process(child));
        } catch (RejectedExecutionException e) {
            reject(child);
        }
    }

    private void process(SocketChannel child) {
        try {
            new ConnectionHandler(child, config, routes, eh).run();
        } catch (Throwable t) {
            // ConnectionHandler lets only Errors through
            LOG.log(ERROR, "Unexpected", t);
            throw t;
        } finally {
            children.remove(child);
            LOG.log(DEBUG, () -> "Closed child: " + child);
        }
    }

    private void reject(SocketChannel child) {
        LOG.log(WARNING, () -> "No worker available, responding 503 to: " + child);
        try (child) {
            var buf = ByteBuffer.wrap(ResponseSerializer.serialize(serviceUnavailable()));
            while (buf.hasRemaining()) {
                child.write(buf);
            }
            child.shutdownOutput();
        } catch (IOException e) {
            LOG.log(WARNING, "Failed to reject child.", e);
        } finally {
            children.remove(child);
        }
    }

    private boolean closeParent() {
        return parent.dropThrowsX(ch -> {
            LOG.log(INFO, () -> "Closing server channel: " + ch);
            try {
                ch.close();
            } catch (IOException e) {
                LOG.log(WARNING, "Failed to close server channel.", e);
            }
        });
    }

    // Wait for children to finish within the graceful period, if there is one
    private void join() {
        workers.shutdown();
        var deadline = waitForChildren;
        if (deadline == null) {
            LOG.log(DEBUG, "No graceful period; closing children.");
            closeChildren();
            return;
        }
        long nanos = Duration.between(now(), deadline).toNanos();
        try {
            if (workers.awaitTermination(nanos, NANOSECONDS)) {
                LOG.log(DEBUG, "All children finished within the graceful period.");
            } else {
                LOG.log(DEBUG, "Graceful deadline expired; closing children.");
                closeChildren();
            }
        } catch (InterruptedException e) {
            LOG.log(DEBUG, "Interrupted while waiting; closing children.");
            closeChildren();
            Thread.currentThread().interrupt();
        }
    }

    private void closeChildren() {
        // Workers blocked in a read observe ClosedByInterruptException
        workers.shutdownNow();
        for (var child : children) {
            try {
                child.close();
            } catch (IOException e) {
                LOG.log(WARNING, "Failed to close child.", e);
            }
        }
    }

    @Override
    public void stop(Duration timeout) throws InterruptedException {
        waitForChildren = now().plus(requireNonNull(timeout));
        if (closeParent()) {
            terminated.await();
        }
    }

    @Override
    public void kill() {
        waitForChildren = null;
        if (closeParent()) {
            closeChildren();
        }
    }

    @Override
    public boolean isRunning() {
        return parent.isPresent();
    }

    @Override
    public Config getConfig() {
        return config;
    }

    @Override
    public SocketAddress getLocalAddress() {
        var channel = parent.peek()
                .orElseThrow(DefaultServer::notRunning);
        try {
            var addr = channel.getLocalAddress();
            if (addr == null) {
                throw notRunning();
            }
            return addr;
        } catch (ClosedChannelException e) {
            throw notRunning();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public HttpServer register(String path, RequestHandler handler) {
        routes.register(path, handler);
        return this;
    }

    @Override
    public Optional<RequestHandler> unregister(String path) {
        return routes.unregister(path);
    }

    @Override
    public Optional<RequestHandler> dispatch(String path) {
        return routes.dispatch(path);
    }

    private static SocketAddress loopBackSystemPickedPort() {
        return new InetSocketAddress(getLoopbackAddress(), 0);
    }

    private static IllegalStateException notRunning() {
        return new IllegalStateException("Server is not running");
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "TinyHttpWorker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

package alpha.tinyhttp.core.mediumtest;

import alpha.tinyhttp.HttpServer;
import alpha.tinyhttp.testutil.TestClient;
import alpha.tinyhttp.testutil.functional.AbstractRealTest;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.nio.channels.SocketChannel;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static alpha.tinyhttp.testutil.TestClient.CRLF;
import static alpha.tinyhttp.testutil.TestClient.readTextUntilEOS;
import static alpha.tinyhttp.testutil.TestClient.write;
import static java.lang.System.Logger.Level.WARNING;
import static java.time.Duration.ofSeconds;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Server life-cycle tests; essentially start/stop, and what happens to
 * connections in between.
 */
final class ServerLifeCycleTest extends AbstractRealTest
{
    private static final String GET_ROOT = "GET / HTTP/1.1" + CRLF + CRLF;

    @Test
    void startStop_async() throws Exception {
        // Uses HttpServer.startAsync()
        int port = server().getPort();
        // Can open connection
        client().openConnection().close();
        // Stop
        stopServer();
        // Can not open connection
        assertThatThrownBy(() -> new TestClient(port).openConnection())
                .isExactlyInstanceOf(ConnectException.class);
    }

    // Without the superclass support; asserting less
    @Test
    void startStop_block() throws Exception {
        var server = HttpServer.create();
        var port = new AtomicInteger();
        var latch = new CountDownLatch(1);
        ExecutorService exec = Executors.newSingleThreadExecutor();
        try {
            Future<?> fut = exec.submit(() -> {
                server.start(p -> {
                    port.set(p);
                    latch.countDown();
                });
                return null;
            });
            assertThat(latch.await(1, SECONDS)).isTrue();
            assertThat(fut.isDone()).isFalse();
            assertThat(server.getPort()).isEqualTo(port.get());
            server.stop();
            assertThat(server.isRunning()).isFalse();
            assertThat(fut.get(1, SECONDS)).isNull();
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    void startTwice() throws Exception {
        var s = server();
        assertThatThrownBy(() -> s.start(0))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Server has started once before");
        assertThat(s.isRunning()).isTrue();
    }

    @Test
    void noRestart() throws Exception {
        var s = HttpServer.create();
        s.startAsync();
        s.stop();
        assertThatThrownBy(s::startAsync)
                .isExactlyInstanceOf(IllegalStateException.class);
        assertThat(s.isRunning()).isFalse();
    }

    @Test
    void getPort_notRunning() {
        var s = HttpServer.create();
        assertThat(s.isRunning()).isFalse();
        assertThatThrownBy(s::getPort)
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Server is not running");
    }

    @Test
    void stop_activeExchangeCompletes() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        server().register("/", (req, rsp) -> {
            entered.countDown();
            assertThat(release.await(3, SECONDS)).isTrue();
            rsp.setContent("done", "text/plain");
        });
        try (SocketChannel ch = client().openConnection()) {
            write(ch, GET_ROOT);
            assertThat(entered.await(1, SECONDS)).isTrue();
            var stop = CompletableFuture.runAsync(() -> {
                try {
                    server().stop(ofSeconds(3));
                } catch (Exception e) {
                    throw new AssertionError(e);
                }
            });
            // Parent closes at once; stop() waits for the child
            MILLISECONDS.sleep(100);
            assertThat(stop).isNotDone();
            release.countDown();
            assertThat(readTextUntilEOS(ch)).endsWith(CRLF + CRLF + "done");
            stop.get(1, SECONDS);
        }
    }

    // Without the superclass support; the aborted exchange logs problems
    @Test
    void kill_activeExchangeAborted() throws Exception {
        var server = HttpServer.create();
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        server.register("/", (req, rsp) -> {
            entered.countDown();
            release.await(3, SECONDS);
        });
        var fut = server.startAsync();
        try (SocketChannel ch = new TestClient(server).openConnection()) {
            write(ch, GET_ROOT);
            assertThat(entered.await(1, SECONDS)).isTrue();
            server.kill();
            assertThat(server.isRunning()).isFalse();
            // Worker is interrupted and the child closed; no 200 in any case
            assertThat(readTextUntilEOS(ch)).doesNotStartWith("HTTP/1.1 200");
        } finally {
            release.countDown();
        }
        assertThat(fut.get(1, SECONDS)).isNull();
    }

    @Test
    void registerWhileRunning() throws Exception {
        var rsp1 = client().writeReadTextUntilEOS(GET_ROOT);
        assertThat(rsp1).startsWith("HTTP/1.1 404 Not Found" + CRLF);
        server().register("/", (req, rsp) -> rsp.setContent("Hi", "text/plain"));
        var rsp2 = client().writeReadTextUntilEOS(GET_ROOT);
        assertThat(rsp2).endsWith(CRLF + CRLF + "Hi");
        assertThat(server().unregister("/")).isPresent();
        var rsp3 = client().writeReadTextUntilEOS(GET_ROOT);
        assertThat(rsp3).startsWith("HTTP/1.1 404 Not Found" + CRLF);
    }

    @Test
    void allWorkersBusy_503() throws Exception {
        usingConfiguration()
                .workerThreads(1)
                .maxQueuedConnections(1);
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        server().register("/block", (req, rsp) -> {
            entered.countDown();
            assertThat(release.await(3, SECONDS)).isTrue();
            rsp.setContent("unblocked", "text/plain");
        });
        try (SocketChannel busy   = client().openConnection();
             SocketChannel queued = client().openConnection())
        {
            write(busy, "GET /block HTTP/1.1" + CRLF + CRLF);
            assertThat(entered.await(1, SECONDS)).isTrue();
            write(queued, GET_ROOT);
            // Worker is busy and the queue is full
            try (SocketChannel rejected = client().openConnection()) {
                assertThat(readTextUntilEOS(rejected))
                        .startsWith("HTTP/1.1 503 Service Unavailable" + CRLF);
            }
            release.countDown();
            assertThat(readTextUntilEOS(busy)).endsWith("unblocked");
            assertThat(readTextUntilEOS(queued)).startsWith("HTTP/1.1 404 Not Found" + CRLF);
        }
        logRecorder().assertRemove(WARNING, "No worker available, responding 503");
    }

    @Test
    void openAndClose_noRequest() throws Exception {
        client().openConnection().close();
        // Server sees end-of-stream before any byte; nothing to log above DEBUG
        var rsp = client().writeReadTextUntilEOS(GET_ROOT);
        assertThat(rsp).startsWith("HTTP/1.1 404 Not Found" + CRLF);
    }

    @Test
    void stopTwice_isNop() throws Exception {
        var s = server();
        s.stop(ofSeconds(1));
        s.stop(ofSeconds(1));
        s.kill();
        assertThat(s.isRunning()).isFalse();
    }
}

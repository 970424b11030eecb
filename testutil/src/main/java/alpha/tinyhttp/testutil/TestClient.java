package alpha.tinyhttp.testutil;

import alpha.tinyhttp.HttpServer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.net.InetAddress.getLoopbackAddress;
import static java.nio.ByteBuffer.allocate;
import static java.nio.ByteBuffer.wrap;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * A client of the server, operating on a raw socket.<p>
 *
 * The server closes each connection after the response, so every exchange
 * reads until end-of-stream. Each exchange opens a new connection, unless a
 * channel is given explicitly.<p>
 *
 * All blocking operations are aborted after 3 seconds, by closing the
 * channel.
 */
public final class TestClient
{
    /** Line terminator. */
    public static final String CRLF = "\r\n";

    private static final System.Logger LOG
            = System.getLogger(TestClient.class.getPackageName());

    private static final ScheduledExecutorService TIMEOUT
            = Executors.newSingleThreadScheduledExecutor(r -> {
                var t = new Thread(r, "TestClientTimeout");
                t.setDaemon(true);
                return t;
            });

    private final int port;

    /**
     * Constructs a {@code TestClient}.
     *
     * @param server to connect to
     */
    public TestClient(HttpServer server) {
        this(server.getPort());
    }

    /**
     * Constructs a {@code TestClient}.
     *
     * @param port to connect to on the loopback address
     */
    public TestClient(int port) {
        this.port = port;
    }

    /**
     * Open a new connection.
     *
     * @return the channel
     * @throws IOException if an I/O error occurs
     */
    public SocketChannel openConnection() throws IOException {
        return SocketChannel.open(new InetSocketAddress(getLoopbackAddress(), port));
    }

    /**
     * Write a request on a new connection and read the response until
     * end-of-stream.
     *
     * @param request to write, encoded using ISO-8859-1
     * @return the response, decoded using ISO-8859-1
     * @throws IOException if an I/O error occurs
     */
    public String writeReadTextUntilEOS(String request) throws IOException {
        return exchange(request, false);
    }

    /**
     * Write a request on a new connection, shutdown the output stream, and
     * read the response until end-of-stream.<p>
     *
     * This signals to the server that no more bytes will arrive.
     *
     * @param request to write, encoded using ISO-8859-1
     * @return the response, decoded using ISO-8859-1
     * @throws IOException if an I/O error occurs
     */
    public String writeShutdownReadTextUntilEOS(String request) throws IOException {
        return exchange(request, true);
    }

    /**
     * Write bytes on a new connection and read the response until
     * end-of-stream.
     *
     * @param request to write
     * @param shutdownOutput whether to shut down the output stream after write
     * @return the response
     * @throws IOException if an I/O error occurs
     */
    public byte[] writeReadBytesUntilEOS(byte[] request, boolean shutdownOutput)
            throws IOException {
        try (var ch = openConnection()) {
            write(ch, request);
            if (shutdownOutput) {
                ch.shutdownOutput();
            }
            return readBytesUntilEOS(ch);
        }
    }

    private String exchange(String request, boolean shutdownOutput) throws IOException {
        return new String(writeReadBytesUntilEOS(
                request.getBytes(ISO_8859_1), shutdownOutput), ISO_8859_1);
    }

    /**
     * Write text on a channel.
     *
     * @param ch channel
     * @param text encoded using ISO-8859-1
     * @throws IOException if an I/O error occurs
     */
    public static void write(SocketChannel ch, String text) throws IOException {
        write(ch, text.getBytes(ISO_8859_1));
    }

    /**
     * Read text from a channel until end-of-stream.
     *
     * @param ch channel
     * @return the text, decoded using ISO-8859-1
     * @throws IOException if an I/O error occurs
     */
    public static String readTextUntilEOS(SocketChannel ch) throws IOException {
        return new String(readBytesUntilEOS(ch), ISO_8859_1);
    }

    private static void write(SocketChannel ch, byte[] bytes) throws IOException {
        var abort = TIMEOUT.schedule(() -> close(ch), 3, SECONDS);
        try {
            ByteBuffer buf = wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
        } finally {
            abort.cancel(false);
        }
    }

    private static byte[] readBytesUntilEOS(SocketChannel ch) throws IOException {
        var sink = new ByteArrayOutputStream();
        var abort = TIMEOUT.schedule(() -> close(ch), 3, SECONDS);
        try {
            ByteBuffer buf = allocate(512);
            while (ch.read(buf) != -1) {
                sink.write(buf.array(), 0, buf.position());
                buf.clear();
            }
            LOG.log(DEBUG, () -> "EOS after " + sink.size() + " bytes.");
            return sink.toByteArray();
        } finally {
            abort.cancel(false);
        }
    }

    private static void close(SocketChannel ch) {
        LOG.log(WARNING, "Client timed out, closing channel.");
        try {
            ch.close();
        } catch (IOException e) {
            LOG.log(WARNING, "Failed to close channel.", e);
        }
    }
}

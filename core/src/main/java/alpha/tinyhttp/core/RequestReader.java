package alpha.tinyhttp.core;

import alpha.tinyhttp.message.MaxRequestSizeException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;

import static alpha.tinyhttp.core.ParseResult.Kind.TRUNCATED;
import static java.lang.System.Logger.Level.DEBUG;

/**
 * Reads one request from a channel.<p>
 *
 * Bytes are read into a buffer of fixed capacity, and the
 * {@link RequestParser} is run after each read, until the request is complete
 * or known to be malformed.<p>
 *
 * A request that does not fit in the buffer causes a
 * {@link MaxRequestSizeException}. This is known as soon as the head has been
 * received, if the declared body would not fit, otherwise when the buffer is
 * full.<p>
 *
 * If the channel reaches end-of-stream while the request is still truncated,
 * the result becomes malformed. If end-of-stream is reached before any byte
 * was received, there is no request at all.
 */
final class RequestReader
{
    private static final System.Logger LOG
            = System.getLogger(RequestReader.class.getPackageName());

    private final ReadableByteChannel channel;
    private final ByteBuffer buf;

    /**
     * Constructs a {@code RequestReader}.
     *
     * @param channel to read from
     * @param maxRequestSize capacity of the read buffer
     */
    RequestReader(ReadableByteChannel channel, int maxRequestSize) {
        this.channel = channel;
        this.buf = ByteBuffer.allocate(maxRequestSize);
    }

    /**
     * Reads a request.<p>
     *
     * The returned result is either complete or malformed, never truncated.
     *
     * @return the result, or {@code null} if the client sent nothing
     *
     * @throws MaxRequestSizeException
     *             if the request does not fit in the buffer
     * @throws IOException
     *             if an I/O error occurs
     */
    ParseResult read() throws IOException {
        ParseResult res = null;
        for (;;) {
            if (!buf.hasRemaining()) {
                throw new MaxRequestSizeException(buf.capacity(), res.requiredLength());
            }
            // A blocking channel never returns 0
            if (channel.read(buf) <= 0) {
                if (res == null) {
                    LOG.log(DEBUG, "End of stream before any byte was received.");
                    return null;
                }
                LOG.log(DEBUG, () -> "End of stream after " + buf.position() +
                        " bytes, request incomplete.");
                return res.toMalformed();
            }
            res = RequestParser.parse(buf.array(), buf.position());
            if (res.kind() != TRUNCATED) {
                return res;
            }
            if (res.requiredLength() > buf.capacity()) {
                throw new MaxRequestSizeException(buf.capacity(), res.requiredLength());
            }
        }
    }

    /**
     * {@return the number of bytes read so far}
     */
    int bytesRead() {
        return buf.position();
    }
}

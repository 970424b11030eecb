package alpha.tinyhttp.core;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.ByteChannel;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayDeque;
import java.util.Deque;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * A channel reading from pre-defined chunks and recording what is written.<p>
 *
 * Each read returns at most one chunk. When the chunks are exhausted, the
 * read returns end-of-stream.<p>
 *
 * A channel that {@link #stallWrites() stalls writes} blocks each write until
 * the channel is closed.
 */
final class InMemoryChannel implements ByteChannel
{
    static InMemoryChannel of(String... chunks) {
        var ch = new InMemoryChannel();
        for (String c : chunks) {
            ch.chunks.add(ByteBuffer.wrap(c.getBytes(ISO_8859_1)));
        }
        return ch;
    }

    private final Deque<ByteBuffer> chunks = new ArrayDeque<>();
    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private volatile boolean open = true;
    private boolean stallWrites;
    private int reads;

    synchronized InMemoryChannel stallWrites() {
        stallWrites = true;
        return this;
    }

    @Override
    public synchronized int read(ByteBuffer dst) throws ClosedChannelException {
        requireOpen();
        ++reads;
        var c = chunks.peek();
        if (c == null) {
            return -1;
        }
        int n = Math.min(dst.remaining(), c.remaining());
        for (int i = 0; i < n; ++i) {
            dst.put(c.get());
        }
        if (!c.hasRemaining()) {
            chunks.poll();
        }
        return n;
    }

    @Override
    public synchronized int write(ByteBuffer src) throws ClosedChannelException {
        requireOpen();
        if (stallWrites) {
            try {
                while (open) {
                    wait();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ClosedByInterruptException();
            }
            throw new AsynchronousCloseException();
        }
        int n = src.remaining();
        while (src.hasRemaining()) {
            written.write(src.get());
        }
        return n;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        synchronized (this) {
            notifyAll();
        }
    }

    synchronized int reads() {
        return reads;
    }

    synchronized String writtenText() {
        return written.toString(ISO_8859_1);
    }

    private void requireOpen() throws ClosedChannelException {
        if (!open) {
            throw new ClosedChannelException();
        }
    }
}

package alpha.tinyhttp.core;

import alpha.tinyhttp.Config;
import alpha.tinyhttp.handler.ExceptionHandler;
import alpha.tinyhttp.handler.RequestHandler;
import alpha.tinyhttp.message.MaxRequestSizeException;
import alpha.tinyhttp.message.Request;
import alpha.tinyhttp.message.Response;
import alpha.tinyhttp.route.Router;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.channels.SocketChannel;
import java.util.List;
import java.util.Optional;

import static alpha.tinyhttp.core.ConnectionHandler.State.ACCEPTED;
import static alpha.tinyhttp.core.ConnectionHandler.State.CLOSED;
import static alpha.tinyhttp.core.ConnectionHandler.State.DISPATCHED;
import static alpha.tinyhttp.core.ConnectionHandler.State.PARSED;
import static alpha.tinyhttp.core.ConnectionHandler.State.READING;
import static alpha.tinyhttp.core.ConnectionHandler.State.RESPONDING;
import static alpha.tinyhttp.message.Responses.internalServerError;
import static alpha.tinyhttp.message.Responses.notFound;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Processes one connection, from the first byte read to close.<p>
 *
 * One request is read and one response is written, after which the channel
 * is closed. The handler moves through the states of {@link State} in order,
 * possibly skipping some, and always ends in {@link State#CLOSED}.<p>
 *
 * Reading and writing each has a deadline. When a deadline expires, the
 * channel is closed, which aborts the blocked operation.<p>
 *
 * A request that can not be parsed, or that is too large, as well as an
 * exception thrown by the request handler, is given to the exception handler
 * chain, which produces the response. If the chain itself fails, the response
 * is "500 Internal Server Error".<p>
 *
 * Transport errors are logged and abandon the connection. No exception
 * escapes {@link #run()}, except {@code Error}s.
 */
final class ConnectionHandler
{
    private static final System.Logger LOG
            = System.getLogger(ConnectionHandler.class.getPackageName());

    /**
     * The life cycle of a connection.
     */
    enum State {
        /** Connection accepted, nothing done yet. */
        ACCEPTED,
        /** Receiving the request. */
        READING,
        /** The request bytes have been parsed, or rejected. */
        PARSED,
        /** The request has been given to a request handler. */
        DISPATCHED,
        /** Writing the response. */
        RESPONDING,
        /** Channel closed. */
        CLOSED
    }

    private final ByteChannel channel;
    private final Config config;
    private final Router router;
    private final List<ExceptionHandler> handlers;
    private volatile State state;
    private volatile boolean timedOut;

    /**
     * Constructs a {@code ConnectionHandler}.
     *
     * @param channel  the connection
     * @param config   server's configuration
     * @param router   source of request handlers
     * @param handlers exception handlers, in order; {@code BASE} implicitly last
     */
    ConnectionHandler(
            ByteChannel channel, Config config,
            Router router, List<ExceptionHandler> handlers) {
        this.channel  = requireNonNull(channel);
        this.config   = requireNonNull(config);
        this.router   = requireNonNull(router);
        this.handlers = List.copyOf(handlers);
        this.state    = ACCEPTED;
        this.timedOut = false;
    }

    /**
     * {@return the current state}
     */
    State state() {
        return state;
    }

    /**
     * Processes the connection.
     */
    void run() {
        try {
            Response rsp = receiveAndProcess();
            if (rsp != null) {
                write(rsp);
            }
        } catch (IOException e) {
            if (timedOut) {
                LOG.log(DEBUG, () -> "Aborted by timeout: " + e);
            } else {
                LOG.log(WARNING, "Transport failure, abandoning connection.", e);
            }
        } catch (RuntimeException e) {
            LOG.log(ERROR, "Unexpected, abandoning connection.", e);
        } finally {
            close();
        }
    }

    private Response receiveAndProcess() throws IOException {
        transition(READING);
        ParseResult res;
        var timer = new Timeout(config.timeoutRead());
        timer.schedule(() -> onTimeout("Read"));
        try {
            res = new RequestReader(channel, config.maxRequestSize()).read();
        } catch (MaxRequestSizeException e) {
            transition(PARSED);
            LOG.log(DEBUG, () -> "Request too large: " + e.getMessage());
            return handleException(e, null);
        } finally {
            timer.abort();
        }
        if (res == null) {
            return null;
        }
        transition(PARSED);
        switch (res.kind()) {
            case COMPLETE:
                return dispatch(res.request());
            case MALFORMED:
                var error = res.error();
                LOG.log(DEBUG, () -> "Request rejected: " + error);
                return handleException(error, null);
            default:
                throw new AssertionError("Unexpected: " + res);
        }
    }

    private Response dispatch(Request req) {
        transition(DISPATCHED);
        Optional<RequestHandler> h = router.dispatch(req.path());
        if (h.isEmpty()) {
            LOG.log(DEBUG, () -> "No handler for \"" + req.path() + "\", responding 404.");
            return notFound();
        }
        var rsp = new Response();
        try {
            h.get().handle(req, rsp);
        } catch (Exception e) {
            return handleException(e, req);
        }
        return rsp;
    }

    private Response handleException(Exception exc, Request req) {
        try {
            return callChain(0, exc, req);
        } catch (Exception fromChain) {
            if (fromChain != exc) {
                fromChain.addSuppressed(exc);
            }
            LOG.log(ERROR, "Exception handler failed, responding 500.", fromChain);
            return internalServerError();
        }
    }

    private Response callChain(int idx, Exception exc, Request req) throws Exception {
        if (idx == handlers.size()) {
            return ExceptionHandler.BASE.apply(exc, null, req);
        }
        Response rsp = handlers.get(idx).apply(exc, () -> callChain(idx + 1, exc, req), req);
        return requireNonNull(rsp, "Exception handler returned null.");
    }

    private void write(Response rsp) throws IOException {
        transition(RESPONDING);
        var buf = ByteBuffer.wrap(ResponseSerializer.serialize(rsp));
        var timer = new Timeout(config.timeoutWrite());
        timer.schedule(() -> onTimeout("Write"));
        try {
            while (buf.hasRemaining()) {
                channel.write(buf);
            }
        } finally {
            timer.abort();
        }
        LOG.log(DEBUG, () -> "Sent " + rsp.statusCode() + " (" +
                buf.limit() + " bytes).");
        if (channel instanceof SocketChannel) {
            ((SocketChannel) channel).shutdownOutput();
        }
    }

    private void onTimeout(String what) {
        timedOut = true;
        LOG.log(WARNING, () -> what + " timed out, closing: " + channel);
        closeChannel();
    }

    private void close() {
        closeChannel();
        transition(CLOSED);
    }

    private void closeChannel() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOG.log(WARNING, "Failed to close channel.", e);
        }
    }

    private void transition(State next) {
        var prev = state;
        state = next;
        LOG.log(DEBUG, () -> prev + " -> " + next);
    }
}

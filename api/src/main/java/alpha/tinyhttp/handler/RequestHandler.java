package alpha.tinyhttp.handler;

import alpha.tinyhttp.message.Request;
import alpha.tinyhttp.message.Response;
import alpha.tinyhttp.route.Router;

/**
 * Processes a request into a response.<p>
 *
 * A request handler is registered with a {@link Router} under an exact path.
 * When a request for that path arrives, the server creates a new default
 * {@link Response} ("200 OK", no headers, no body) and gives it to the handler
 * together with the request. Whatever state the response is in when the
 * handler returns is what gets written to the client.<p>
 *
 * <pre>{@code
 *   server.register("/hello", (req, rsp) ->
 *           rsp.setContent("Hello, " + req.bodyAsText(), "text/plain"));
 * }</pre>
 *
 * The handler is called by a worker thread of the server, possibly by many
 * worker threads concurrently. Any state shared across invocations must be
 * thread-safe.<p>
 *
 * Any exception thrown by the handler is given to the server's chain of
 * {@link ExceptionHandler}s, which by default responds
 * "500 Internal Server Error", unless the exception implements
 * {@link HasResponse}.
 *
 * @see RequestHandlers
 */
@FunctionalInterface
public interface RequestHandler {
    /**
     * Handle a request.
     *
     * @param request  the request
     * @param response the response to populate
     *
     * @throws Exception for any reason
     */
    void handle(Request request, Response response) throws Exception;
}

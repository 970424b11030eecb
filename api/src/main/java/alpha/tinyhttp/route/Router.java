package alpha.tinyhttp.route;

import alpha.tinyhttp.handler.RequestHandler;

import java.util.Optional;

/**
 * A registry of request handlers, each bound to an exact request path.<p>
 *
 * The path registered is matched against the path of a request exactly, as a
 * string. There is no prefix, wildcard or parameter matching, no
 * normalization, and trailing slashes are significant. "/a" and "/a/" are two
 * different paths. A query string, if the client sent one, is part of the
 * request path.<p>
 *
 * Handlers are normally registered before the server starts. The
 * implementation is thread-safe; registering or unregistering while the
 * server is running is safe and never blocks a request in flight.
 */
public interface Router
{
    /**
     * Registers a request handler.<p>
     *
     * A handler already registered for the same path is replaced.
     *
     * @param path    exact request path
     * @param handler the request handler
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any arg is {@code null}
     */
    Router register(String path, RequestHandler handler);

    /**
     * Removes a request handler.
     *
     * @param path exact request path
     * @return the removed handler, if one was registered
     * @throws NullPointerException if {@code path} is {@code null}
     */
    Optional<RequestHandler> unregister(String path);

    /**
     * Looks up the handler registered for a path.
     *
     * @param path exact request path
     * @return the handler, if one is registered
     * @throws NullPointerException if {@code path} is {@code null}
     */
    Optional<RequestHandler> dispatch(String path);
}

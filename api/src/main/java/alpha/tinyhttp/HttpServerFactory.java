package alpha.tinyhttp;

import alpha.tinyhttp.handler.ExceptionHandler;

/**
 * Factory of {@link HttpServer}.<p>
 *
 * The implementation is loaded by {@link HttpServer#create(Config, ExceptionHandler...)}
 * using {@link java.util.ServiceLoader}, and must have a public no-arg
 * constructor.
 */
@FunctionalInterface
public interface HttpServerFactory {
    /**
     * Create a server.
     *
     * @param config of server
     * @param eh exception handlers
     *
     * @return an instance of {@code HttpServer}
     *
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     */
    HttpServer create(Config config, ExceptionHandler... eh);
}

package alpha.tinyhttp.core;

import alpha.tinyhttp.Config;
import alpha.tinyhttp.HttpServer;
import alpha.tinyhttp.HttpServerFactory;
import alpha.tinyhttp.handler.ExceptionHandler;

/**
 * Default {@code HttpServerFactory}.<p>
 *
 * Specified in the provider configuration file
 * {@code META-INF/services/alpha.tinyhttp.HttpServerFactory}.
 */
public class DefaultServerFactory implements HttpServerFactory
{
    /**
     * Constructs this object.
     */
    public DefaultServerFactory() {
        // Empty
    }

    @Override
    public HttpServer create(Config config, ExceptionHandler... eh) {
        return new DefaultServer(config, eh);
    }
}

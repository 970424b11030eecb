package alpha.tinyhttp;

import alpha.tinyhttp.handler.ExceptionHandler;
import alpha.tinyhttp.message.Response;

/**
 * An API for proceeding the exception processing chain.<p>
 *
 * The chain is made up of zero or more {@link ExceptionHandler}s given to
 * {@link HttpServer#create(ExceptionHandler...)}, leading up to the server's
 * {@linkplain ExceptionHandler#BASE base handler}.<p>
 *
 * An exception handler can short-circuit the rest of the chain by not calling
 * {@link #proceed()} and instead return a response of its own.
 */
@FunctionalInterface
public interface Chain
{
    /**
     * Calls the next exception handler in the chain.
     *
     * @return the response returned from the next handler
     *
     * @throws Exception
     *             as propagated from the rest of the chain
     */
    Response proceed() throws Exception;
}

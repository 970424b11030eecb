package alpha.tinyhttp.handler;

import alpha.tinyhttp.Chain;
import alpha.tinyhttp.HttpServer;
import alpha.tinyhttp.message.MalformedRequestException;
import alpha.tinyhttp.message.MaxRequestSizeException;
import alpha.tinyhttp.message.Request;
import alpha.tinyhttp.message.Response;

import static alpha.tinyhttp.message.Responses.internalServerError;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;

/**
 * Handles an exception by producing an alternative response.<p>
 *
 * Exception handlers are given to
 * {@link HttpServer#create(ExceptionHandler...)} and called in the order they
 * were given. Each handler may return a response of its own, or call
 * {@link Chain#proceed()} to delegate to the next handler. The last handler in
 * the chain is always {@link #BASE}.<p>
 *
 * <pre>{@code
 *   ExceptionHandler retryLater = (exc, chain, req) -> {
 *       if (exc instanceof TimeoutException) {
 *           return Responses.serviceUnavailable();
 *       }
 *       return chain.proceed();
 *   };
 *   HttpServer.create(retryLater);
 * }</pre>
 *
 * The exception handler is called for exceptions thrown by a
 * {@link RequestHandler}, in which case the request argument is the request
 * that was given to the request handler. It is also called when the request
 * could not be received ({@link MalformedRequestException},
 * {@link MaxRequestSizeException}), in which case the request argument is
 * {@code null}.<p>
 *
 * The exception handler is called by a worker thread of the server, possibly
 * by many threads concurrently.<p>
 *
 * If the exception handler itself throws an exception, the server logs it and
 * responds "500 Internal Server Error".
 */
@FunctionalInterface
public interface ExceptionHandler
{
    /**
     * Handles an exception.
     *
     * @param exc   the exception to handle (never {@code null})
     * @param chain the rest of the chain (never {@code null})
     * @param req   the request, or {@code null} if it never was received
     *
     * @return an alternative response (never {@code null})
     *
     * @throws Exception for any reason
     */
    Response apply(Exception exc, Chain chain, Request req) throws Exception;

    /**
     * The server's base exception handler.<p>
     *
     * If the exception implements {@link HasResponse}, then
     * {@link HasResponse#getResponse()} is returned. Otherwise, the exception
     * is logged at {@code ERROR} level and
     * {@link alpha.tinyhttp.message.Responses#internalServerError()} is
     * returned.<p>
     *
     * This handler never calls the chain.
     */
    ExceptionHandler BASE = (exc, chainIsNull, req) -> {
        if (exc instanceof HasResponse) {
            logger().log(DEBUG, () -> "Translating to a response: " + exc);
            return ((HasResponse) exc).getResponse();
        }
        logger().log(ERROR, "Request handler failed, responding 500.", exc);
        return internalServerError();
    };

    private static System.Logger logger() {
        return System.getLogger(ExceptionHandler.class.getPackageName());
    }
}

package alpha.tinyhttp.handler;

import alpha.tinyhttp.message.Response;
import alpha.tinyhttp.message.Responses;

/**
 * Adds {@link #getResponse()}.<p>
 *
 * This interface is intended to be implemented by exception classes from
 * components aware of their HTTP environment. Implementing this interface is
 * not mandatory, and the response is advisory.<p>
 *
 * The exception handler is free to derive a new response or return a different
 * one. The server's {@linkplain ExceptionHandler#BASE base exception handler}
 * returns the response provided, unmodified.<p>
 *
 * Each implementing class is in effect a documented HTTP problem. For example:
 *
 * <pre>{@code
 *   final class NoSuchUserException
 *         extends RuntimeException implements HasResponse
 *   {
 *       NoSuchUserException(String id) {
 *           super("No user with id " + id);
 *       }
 *
 *       @Override
 *       public Response getResponse() {
 *           return Responses.notFound();
 *       }
 *   }
 * }</pre>
 */
public interface HasResponse {
    /**
     * Returns an advisory, fallback response for the exception handler.<p>
     *
     * The exception class should never return a response indicating success.
     *
     * @apiNote
     * The "get" prefix is to be consistent with {@code Throwable}'s API design.
     *
     * @return an advisory fallback response (never {@code null})
     * @see Responses
     */
    Response getResponse();
}

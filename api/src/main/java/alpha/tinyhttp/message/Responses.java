package alpha.tinyhttp.message;

import static alpha.tinyhttp.HttpConstants.ReasonPhrase.BAD_REQUEST;
import static alpha.tinyhttp.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.tinyhttp.HttpConstants.ReasonPhrase.NOT_FOUND;
import static alpha.tinyhttp.HttpConstants.ReasonPhrase.PAYLOAD_TOO_LARGE;
import static alpha.tinyhttp.HttpConstants.ReasonPhrase.REQUEST_TIMEOUT;
import static alpha.tinyhttp.HttpConstants.ReasonPhrase.SERVICE_UNAVAILABLE;
import static alpha.tinyhttp.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.tinyhttp.HttpConstants.StatusCode.FIVE_HUNDRED_THREE;
import static alpha.tinyhttp.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.tinyhttp.HttpConstants.StatusCode.FOUR_HUNDRED_EIGHT;
import static alpha.tinyhttp.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.tinyhttp.HttpConstants.StatusCode.FOUR_HUNDRED_THIRTEEN;

/**
 * Factories of {@link Response}s.<p>
 *
 * Each call returns a new response object, which the caller is free to
 * modify.<p>
 *
 * Error responses carry a small HTML body stating the status code and reason
 * phrase, e.g.
 * <pre>
 *   &lt;html&gt;&lt;body&gt;&lt;h1&gt;404 Not Found&lt;/h1&gt;&lt;/body&gt;&lt;/html&gt;
 * </pre>
 */
public final class Responses
{
    private Responses() {
        // Empty
    }

    /**
     * {@return a new "200 OK" response without headers and body}
     */
    public static Response ok() {
        return new Response();
    }

    /**
     * {@return a new "200 OK" response with a "text/plain" body}
     *
     * @param text body
     */
    public static Response text(String text) {
        return ok().setContent(text, "text/plain");
    }

    /**
     * {@return a new "200 OK" response with a "text/html" body}
     *
     * @param html body
     */
    public static Response html(String html) {
        return ok().setContent(html, "text/html");
    }

    /**
     * {@return a new "200 OK" response with an "application/json" body}
     *
     * @param json body
     */
    public static Response json(String json) {
        return ok().setContent(json, "application/json");
    }

    /**
     * {@return a new "400 Bad Request" response}
     */
    public static Response badRequest() {
        return error(FOUR_HUNDRED, BAD_REQUEST);
    }

    /**
     * {@return a new "404 Not Found" response}
     */
    public static Response notFound() {
        return error(FOUR_HUNDRED_FOUR, NOT_FOUND);
    }

    /**
     * {@return a new "408 Request Timeout" response}
     */
    public static Response requestTimeout() {
        return error(FOUR_HUNDRED_EIGHT, REQUEST_TIMEOUT);
    }

    /**
     * {@return a new "413 Payload Too Large" response}
     */
    public static Response payloadTooLarge() {
        return error(FOUR_HUNDRED_THIRTEEN, PAYLOAD_TOO_LARGE);
    }

    /**
     * {@return a new "500 Internal Server Error" response}
     */
    public static Response internalServerError() {
        return error(FIVE_HUNDRED, INTERNAL_SERVER_ERROR);
    }

    /**
     * {@return a new "503 Service Unavailable" response}
     */
    public static Response serviceUnavailable() {
        return error(FIVE_HUNDRED_THREE, SERVICE_UNAVAILABLE);
    }

    private static Response error(int code, String phrase) {
        return new Response()
                .setStatus(code, phrase)
                .setContent("<html><body><h1>" + code + " " + phrase + "</h1></body></html>");
    }
}

package alpha.tinyhttp;

import alpha.tinyhttp.message.Response;
import alpha.tinyhttp.message.Responses;

/**
 * Namespace of constants related to the HTTP protocol.<p>
 *
 * Only the constants used by the server itself, or likely to be used by a
 * request handler, are provided. The server never validates a request's method
 * or version against these constants; they exist for the convenience of the
 * application.
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * HTTP methods are included on the first line of a request and indicate
     * the desired action to be performed on a server-side resource.<p>
     *
     * The method is a case-sensitive token and can be anything. The server
     * does not reject a request based on its method; routing is done on the
     * path alone.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.1">RFC 7231 §4.1</a>
     */
    public static final class Method {
        private Method() {
            // Private
        }

        /** Transfer a current representation of the target resource. */
        public static final String GET = "GET";

        /** Perform resource-specific processing on the request payload. */
        public static final String POST = "POST";
    }

    /**
     * Status codes used by the server's own responses.<p>
     *
     * The status code and its reason phrase are set independently on a
     * {@link Response}; there is no automatic lookup from code to phrase. The
     * factories in {@link Responses} pair each code with the corresponding
     * {@link ReasonPhrase}.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }

        /** {@value} {@value ReasonPhrase#OK}. */
        public static final int TWO_HUNDRED = 200;

        /** {@value} {@value ReasonPhrase#BAD_REQUEST}. */
        public static final int FOUR_HUNDRED = 400;

        /** {@value} {@value ReasonPhrase#NOT_FOUND}. */
        public static final int FOUR_HUNDRED_FOUR = 404;

        /** {@value} {@value ReasonPhrase#REQUEST_TIMEOUT}. */
        public static final int FOUR_HUNDRED_EIGHT = 408;

        /** {@value} {@value ReasonPhrase#PAYLOAD_TOO_LARGE}. */
        public static final int FOUR_HUNDRED_THIRTEEN = 413;

        /** {@value} {@value ReasonPhrase#INTERNAL_SERVER_ERROR}. */
        public static final int FIVE_HUNDRED = 500;

        /** {@value} {@value ReasonPhrase#SERVICE_UNAVAILABLE}. */
        public static final int FIVE_HUNDRED_THREE = 503;
    }

    /**
     * Reason phrases that go with the {@link StatusCode}s.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }

        /** Goes with status code {@value StatusCode#TWO_HUNDRED}. */
        public static final String OK = "OK";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED}. */
        public static final String BAD_REQUEST = "Bad Request";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_FOUR}. */
        public static final String NOT_FOUND = "Not Found";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_EIGHT}. */
        public static final String REQUEST_TIMEOUT = "Request Timeout";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_THIRTEEN}. */
        public static final String PAYLOAD_TOO_LARGE = "Payload Too Large";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED}. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_THREE}. */
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";
    }

    /**
     * Header names.<p>
     *
     * Header names are case-insensitive according to the HTTP specification,
     * but this server stores and looks them up as given. The constants below
     * use the canonical capitalization.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Private
        }

        /** Number of bytes in the message body. */
        public static final String CONTENT_LENGTH = "Content-Length";

        /** Media type of the message body. */
        public static final String CONTENT_TYPE = "Content-Type";
    }

    /**
     * HTTP versions, as they appear on the wire.<p>
     *
     * The server echoes nothing from the request's version. All responses
     * default to {@link #HTTP_1_1}.
     */
    public static final class Version {
        private Version() {
            // Private
        }

        /** HTTP/1.1. */
        public static final String HTTP_1_1 = "HTTP/1.1";
    }
}

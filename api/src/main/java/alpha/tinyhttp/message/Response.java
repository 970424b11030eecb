package alpha.tinyhttp.message;

import alpha.tinyhttp.HttpConstants.ReasonPhrase;
import alpha.tinyhttp.HttpConstants.StatusCode;
import alpha.tinyhttp.HttpConstants.Version;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static alpha.tinyhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.tinyhttp.HttpConstants.HeaderName.CONTENT_TYPE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * An outbound HTTP response.<p>
 *
 * A new response starts out as "HTTP/1.1 200 OK" with no headers and an empty
 * body. The request handler is given one such response and modifies it in
 * place.<p>
 *
 * The status code and reason phrase are two independent properties; setting
 * one does not look up the other. Use {@link #setStatus(int, String)}.<p>
 *
 * The {@code setContent} methods replace the body and, in the same go, set
 * both the "Content-Type" and "Content-Length" headers. {@link #setBody(byte[])}
 * replaces only the body; it is then the application's responsibility to keep
 * the headers in sync. The server writes the headers exactly as they are
 * when the handler returns.<p>
 *
 * Headers are written in the order they were first set.<p>
 *
 * The implementation is not thread-safe.
 *
 * @see Responses
 */
public final class Response
{
    private String version;
    private int statusCode;
    private String statusMessage;
    private final Map<String, String> headers;
    private final Map<String, String> headersView;
    private byte[] body;

    /**
     * Constructs a {@code Response}.<p>
     *
     * The response will have version "HTTP/1.1", status code 200, status
     * message "OK", no headers and an empty body.
     */
    public Response() {
        version       = Version.HTTP_1_1;
        statusCode    = StatusCode.TWO_HUNDRED;
        statusMessage = ReasonPhrase.OK;
        headers       = new LinkedHashMap<>();
        headersView   = Collections.unmodifiableMap(headers);
        body          = new byte[0];
    }

    /**
     * {@return the HTTP version}
     */
    public String version() {
        return version;
    }

    /**
     * {@return the status code}
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * {@return the status message (reason phrase)}
     */
    public String statusMessage() {
        return statusMessage;
    }

    /**
     * Returns an unmodifiable view of the headers.<p>
     *
     * The view reflects subsequent changes made to this response.
     *
     * @return an unmodifiable view of the headers
     */
    public Map<String, String> headers() {
        return headersView;
    }

    /**
     * Returns the value of a header.
     *
     * @param name of header
     * @return the header value, if present
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(requireNonNull(name)));
    }

    /**
     * {@return a copy of the body bytes}
     */
    public byte[] body() {
        return body.clone();
    }

    /**
     * Set the HTTP version.
     *
     * @param version e.g. "HTTP/1.0"
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code version} is {@code null}
     */
    public Response setVersion(String version) {
        this.version = requireNonNull(version);
        return this;
    }

    /**
     * Set the status code and status message.
     *
     * @param code    status code
     * @param message status message (reason phrase)
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code message} is {@code null}
     */
    public Response setStatus(int code, String message) {
        this.statusMessage = requireNonNull(message);
        this.statusCode = code;
        return this;
    }

    /**
     * Set a header, replacing any previous value.<p>
     *
     * A header that is replaced keeps its position.
     *
     * @param name  of header
     * @param value of header
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException
     *             if {@code name} or {@code value} contains CR or LF
     */
    public Response setHeader(String name, String value) {
        headers.put(requireNoLineBreak(name), requireNoLineBreak(value));
        return this;
    }

    /**
     * Remove a header.
     *
     * @param name of header
     * @return the removed value, if the header was present
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Optional<String> removeHeader(String name) {
        return Optional.ofNullable(headers.remove(requireNonNull(name)));
    }

    /**
     * Replace the body.<p>
     *
     * The array is copied. No header is touched.
     *
     * @param body new body
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code body} is {@code null}
     */
    public Response setBody(byte[] body) {
        this.body = body.clone();
        return this;
    }

    /**
     * Replace the body with HTML.<p>
     *
     * Same as {@code setContent(html, "text/html")}.
     *
     * @param html new body
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code html} is {@code null}
     */
    public Response setContent(String html) {
        return setContent(html, "text/html");
    }

    /**
     * Replace the body with text encoded using UTF-8.<p>
     *
     * Both "Content-Type" and "Content-Length" are set.
     *
     * @param content     new body
     * @param contentType value of "Content-Type"
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any arg is {@code null}
     */
    public Response setContent(String content, String contentType) {
        return setContent(content.getBytes(UTF_8), contentType);
    }

    /**
     * Replace the body with bytes.<p>
     *
     * Both "Content-Type" and "Content-Length" are set. The latter will
     * always be equal to the length of the array.
     *
     * @param content     new body
     * @param contentType value of "Content-Type"
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException if {@code contentType} contains CR or LF
     */
    public Response setContent(byte[] content, String contentType) {
        requireNoLineBreak(contentType);
        setBody(content);
        headers.put(CONTENT_TYPE, contentType);
        headers.put(CONTENT_LENGTH, Integer.toString(body.length));
        return this;
    }

    private static String requireNoLineBreak(String str) {
        if (str.indexOf('\r') >= 0 || str.indexOf('\n') >= 0) {
            throw new IllegalArgumentException(
                    "Line break in header: \"" + str.replace("\r", "\\r").replace("\n", "\\n") + "\"");
        }
        return str;
    }

    @Override
    public String toString() {
        return Response.class.getSimpleName() + '{' + String.join(", ",
                "version=" + version,
                "statusCode=" + statusCode,
                "statusMessage=" + statusMessage,
                "headers=" + headers,
                "bodyLength=" + body.length) + '}';
    }
}

package alpha.tinyhttp.message;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * An inbound HTTP request.<p>
 *
 * The request is created by the server after having parsed the request bytes
 * received from the client, and then passed to the request handler registered
 * for the request's path.<p>
 *
 * None of the components of the request line are validated. The method may be
 * any token, the path is the request-target verbatim (a query string, if
 * present, is part of it) and the version is whatever the client sent.<p>
 *
 * Headers are stored and looked up by their exact name, as received. If the
 * client sent a header more than once, the last value is kept. The
 * {@link #headers()} map iterates in the order the headers were first
 * received.<p>
 *
 * The implementation is immutable and thread-safe.
 */
public final class Request
{
    private final String method, path, version;
    private final Map<String, String> headers;
    private final byte[] body;

    /**
     * Constructs a {@code Request}.<p>
     *
     * The given map and array are copied.
     *
     * @param method  request method
     * @param path    request path
     * @param version HTTP version
     * @param headers request headers
     * @param body    request body (may be empty)
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    public Request(
            String method, String path, String version,
            Map<String, String> headers, byte[] body) {
        this.method  = requireNonNull(method);
        this.path    = requireNonNull(path);
        this.version = requireNonNull(version);
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body    = body.clone();
    }

    /**
     * {@return the request method, e.g. "GET"}
     */
    public String method() {
        return method;
    }

    /**
     * {@return the request path, e.g. "/index.html"}
     */
    public String path() {
        return path;
    }

    /**
     * {@return the HTTP version, e.g. "HTTP/1.1"}
     */
    public String version() {
        return version;
    }

    /**
     * {@return an unmodifiable map of all headers}
     */
    public Map<String, String> headers() {
        return headers;
    }

    /**
     * Returns the value of a header.<p>
     *
     * The name is matched exactly, i.e. case-sensitive.
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
     * {@return the number of body bytes}
     */
    public int bodyLength() {
        return body.length;
    }

    /**
     * {@return the body decoded using UTF-8}
     */
    public String bodyAsText() {
        return new String(body, UTF_8);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Request)) {
            return false;
        }
        var other = (Request) obj;
        return method.equals(other.method) &&
               path.equals(other.path) &&
               version.equals(other.version) &&
               headers.equals(other.headers) &&
               Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        int h = method.hashCode();
        h = 31 * h + path.hashCode();
        h = 31 * h + version.hashCode();
        h = 31 * h + headers.hashCode();
        return 31 * h + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return Request.class.getSimpleName() + '{' + String.join(", ",
                "method=" + method,
                "path=" + path,
                "version=" + version,
                "headers=" + headers,
                "bodyLength=" + body.length) + '}';
    }
}

package alpha.tinyhttp.handler;

import alpha.tinyhttp.message.Responses;
import alpha.tinyhttp.util.MediaTypes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static alpha.tinyhttp.HttpConstants.HeaderName.CONTENT_TYPE;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Factories of {@link RequestHandler}s.
 */
public final class RequestHandlers
{
    private static final System.Logger LOG
            = System.getLogger(RequestHandlers.class.getPackageName());

    private RequestHandlers() {
        // Empty
    }

    /**
     * Returns a handler responding the given content.
     *
     * @param body        response body, encoded using UTF-8
     * @param contentType value of the "Content-Type" header
     * @return a request handler
     * @throws NullPointerException if any arg is {@code null}
     */
    public static RequestHandler content(String body, String contentType) {
        requireNonNull(body);
        requireNonNull(contentType);
        return (req, rsp) -> rsp.setContent(body, contentType);
    }

    /**
     * Returns a handler responding the contents of a file.<p>
     *
     * The file is read anew for each request, which means that the content may
     * change over time. The content type is guessed from the file name
     * extension using {@link MediaTypes#guess(Path)}.<p>
     *
     * If the file can not be read, for example because it does not exist or
     * is a directory, the handler replaces the status and content of the
     * response with that of {@link Responses#notFound()}.
     *
     * @param file to serve
     * @return a request handler
     * @throws NullPointerException if {@code file} is {@code null}
     */
    public static RequestHandler file(Path file) {
        requireNonNull(file);
        return (req, rsp) -> {
            final byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (IOException e) {
                LOG.log(DEBUG, () -> "Can not read " + file + ", responding 404: " + e);
                var nf = Responses.notFound();
                rsp.setStatus(nf.statusCode(), nf.statusMessage())
                   .setContent(nf.body(), nf.header(CONTENT_TYPE).orElseThrow());
                return;
            }
            rsp.setContent(bytes, MediaTypes.guess(file));
        };
    }
}

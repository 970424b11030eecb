package alpha.tinyhttp.message;

import alpha.tinyhttp.handler.HasResponse;

import java.io.Serial;

import static alpha.tinyhttp.message.Responses.badRequest;

/**
 * Thrown, or reported, when the bytes received from a client do not make up a
 * valid request.<p>
 *
 * The position, if known, is the byte offset into the request where the
 * problem was found.
 */
public final class MalformedRequestException
             extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final int pos;

    /**
     * Constructs a {@code MalformedRequestException}.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     * @param pos     byte position, or a negative value if not known
     */
    public MalformedRequestException(String message, int pos) {
        super(message);
        this.pos = pos;
    }

    /**
     * {@return the byte position where the problem was found, or -1 if not known}
     */
    public int position() {
        return pos < 0 ? -1 : pos;
    }

    /**
     * {@return {@link Responses#badRequest()}}
     */
    @Override
    public Response getResponse() {
        return badRequest();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{' + String.join(", ",
                "pos=" + (pos < 0 ? "N/A" : pos),
                "msg=" + getMessage()) + '}';
    }
}

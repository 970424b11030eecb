package alpha.tinyhttp.core;

import alpha.tinyhttp.message.MalformedRequestException;
import alpha.tinyhttp.message.Request;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of {@link RequestParser#parse(byte[], int)}.<p>
 *
 * A result is either {@link Kind#COMPLETE} and carries a request, or it is
 * {@link Kind#TRUNCATED} or {@link Kind#MALFORMED} and carries an error. A
 * truncated result also carries the total number of bytes required for the
 * request to be complete, if known.
 */
final class ParseResult
{
    /**
     * The kind of result.
     */
    enum Kind {
        /** A request was parsed. */
        COMPLETE,
        /** More bytes are needed. */
        TRUNCATED,
        /** The bytes can never make up a request. */
        MALFORMED
    }

    static ParseResult complete(Request request) {
        return new ParseResult(Kind.COMPLETE, requireNonNull(request), null, -1);
    }

    static ParseResult truncated(MalformedRequestException error, int requiredLength) {
        return new ParseResult(Kind.TRUNCATED, null, requireNonNull(error),
                requiredLength < 0 ? -1 : requiredLength);
    }

    static ParseResult malformed(MalformedRequestException error) {
        return new ParseResult(Kind.MALFORMED, null, requireNonNull(error), -1);
    }

    private final Kind kind;
    private final Request request;
    private final MalformedRequestException error;
    private final int requiredLength;

    private ParseResult(
            Kind kind, Request request,
            MalformedRequestException error, int requiredLength) {
        this.kind = kind;
        this.request = request;
        this.error = error;
        this.requiredLength = requiredLength;
    }

    Kind kind() {
        return kind;
    }

    /**
     * {@return the parsed request}
     *
     * @throws IllegalStateException if the kind is not {@code COMPLETE}
     */
    Request request() {
        if (kind != Kind.COMPLETE) {
            throw new IllegalStateException("No request: " + this);
        }
        return request;
    }

    /**
     * {@return the error}
     *
     * @throws IllegalStateException if the kind is {@code COMPLETE}
     */
    MalformedRequestException error() {
        if (kind == Kind.COMPLETE) {
            throw new IllegalStateException("No error: " + this);
        }
        return error;
    }

    /**
     * {@return the total number of bytes needed, or -1 if not known}
     */
    int requiredLength() {
        return requiredLength;
    }

    /**
     * Turns a truncated result into a malformed one.<p>
     *
     * Used when no more bytes will arrive.
     *
     * @return a malformed result with the same error
     * @throws IllegalStateException if the kind is not {@code TRUNCATED}
     */
    ParseResult toMalformed() {
        if (kind != Kind.TRUNCATED) {
            throw new IllegalStateException("Not truncated: " + this);
        }
        return malformed(error);
    }

    @Override
    public String toString() {
        return ParseResult.class.getSimpleName() + '{' + String.join(", ",
                "kind=" + kind,
                "request=" + request,
                "error=" + error,
                "requiredLength=" + requiredLength) + '}';
    }
}

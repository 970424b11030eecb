package alpha.tinyhttp.core;

import alpha.tinyhttp.message.MalformedRequestException;
import alpha.tinyhttp.message.Request;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static alpha.tinyhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.util.Objects.checkFromIndexSize;

/**
 * Parses a request from bytes.<p>
 *
 * The parser is a pure function of the bytes given. It is called anew each
 * time more bytes have been received, and reports whether the bytes make up a
 * complete request, need more bytes, or can never make up a request.<p>
 *
 * The request head is decoded using ISO-8859-1. Lines end with LF, and a CR
 * immediately before the LF is stripped.<p>
 *
 * The request line must consist of exactly three tokens separated by
 * whitespace; method, path and version. None of them is validated any
 * further.<p>
 *
 * Header lines follow until the first empty line. A header line is split on
 * its first colon; the name is everything before it, as is, and the value
 * everything after it with leading spaces and tabs removed. A line without a
 * colon is ignored. If a name repeats, the last value wins.<p>
 *
 * The body is exactly as many bytes as declared by the "Content-Length"
 * header (name matched exactly), or empty if the header is absent. The value
 * must be a non-negative decimal number that fits an {@code int}. Bytes beyond
 * the body are ignored.
 */
final class RequestParser
{
    private static final System.Logger LOG
            = System.getLogger(RequestParser.class.getPackageName());

    private static final byte CR = '\r', LF = '\n';

    private RequestParser() {
        // Empty
    }

    /**
     * Parses a request.
     *
     * @param bytes  source
     * @param length number of bytes in the source to parse, from offset 0
     *
     * @return the result
     *
     * @throws IndexOutOfBoundsException
     *             if {@code length} is negative or larger than the array
     */
    static ParseResult parse(byte[] bytes, int length) {
        checkFromIndexSize(0, length, bytes.length);

        // Request line
        int lf = indexOfLF(bytes, 0, length);
        if (lf < 0) {
            return ParseResult.truncated(
                    new MalformedRequestException("Request line not terminated.", length), -1);
        }
        String[] tokens = line(bytes, 0, lf).trim().split("\\s+");
        if (tokens.length != 3) {
            return ParseResult.malformed(new MalformedRequestException(
                    tokens[0].isEmpty() ? "Empty request line." :
                        "Expected 3 tokens in request line, saw " + tokens.length + ".",
                    0));
        }

        // Headers
        Map<String, String> headers = new LinkedHashMap<>();
        int pos = lf + 1,
            contentLengthPos = -1;
        for (;;) {
            lf = indexOfLF(bytes, pos, length);
            if (lf < 0) {
                return ParseResult.truncated(
                        new MalformedRequestException("Request head not terminated.", length), -1);
            }
            String line = line(bytes, pos, lf);
            if (line.isEmpty()) {
                pos = lf + 1;
                break;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                final int p = pos;
                LOG.log(DEBUG, () -> "Ignoring header line without a colon at pos " + p + ".");
            } else {
                String name = line.substring(0, colon);
                headers.put(name, stripLeadingBlanks(line.substring(colon + 1)));
                if (name.equals(CONTENT_LENGTH)) {
                    contentLengthPos = pos;
                }
            }
            pos = lf + 1;
        }
        final int headLength = pos;

        // Body
        int contentLength = 0;
        String cl = headers.get(CONTENT_LENGTH);
        if (cl != null) {
            contentLength = parseContentLength(cl.trim(), contentLengthPos);
            if (contentLength < 0) {
                return ParseResult.malformed(new MalformedRequestException(
                        "Invalid Content-Length: \"" + cl + "\".", contentLengthPos));
            }
        }
        int available = length - headLength;
        if (available < contentLength) {
            long required = (long) headLength + contentLength;
            return ParseResult.truncated(new MalformedRequestException(
                    "Expected " + contentLength + " body bytes, have " + available + ".", length),
                    required > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) required);
        }

        byte[] body = Arrays.copyOfRange(bytes, headLength, headLength + contentLength);
        return ParseResult.complete(
                new Request(tokens[0], tokens[1], tokens[2], headers, body));
    }

    private static int indexOfLF(byte[] bytes, int from, int to) {
        for (int i = from; i < to; ++i) {
            if (bytes[i] == LF) {
                return i;
            }
        }
        return -1;
    }

    // From start (inclusive) to LF (exclusive), minus one trailing CR
    private static String line(byte[] bytes, int start, int lf) {
        int end = lf > start && bytes[lf - 1] == CR ? lf - 1 : lf;
        return new String(bytes, start, end - start, ISO_8859_1);
    }

    private static String stripLeadingBlanks(String s) {
        int i = 0;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
            ++i;
        }
        return s.substring(i);
    }

    // Returns -1 if not a valid value
    private static int parseContentLength(String v, int pos) {
        if (v.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < v.length(); ++i) {
            char c = v.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            LOG.log(DEBUG, () -> "Content-Length at pos " + pos + " overflows int: " + v);
            return -1;
        }
    }
}

package alpha.tinyhttp.core;

import alpha.tinyhttp.message.Request;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static alpha.tinyhttp.core.ParseResult.Kind.COMPLETE;
import static alpha.tinyhttp.core.ParseResult.Kind.MALFORMED;
import static alpha.tinyhttp.core.ParseResult.Kind.TRUNCATED;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.util.Map.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link RequestParser}.
 */
final class RequestParserTest
{
    @Nested
    class Complete {
        @Test
        void postWithBody() {
            var req = complete("""
                    POST /submit HTTP/1.1\r
                    Host: x\r
                    Content-Length: 11\r
                    \r
                    hello world""");
            assertThat(req.method()).isEqualTo("POST");
            assertThat(req.path()).isEqualTo("/submit");
            assertThat(req.version()).isEqualTo("HTTP/1.1");
            assertThat(req.headers()).containsExactly(
                    entry("Host", "x"),
                    entry("Content-Length", "11"));
            assertThat(req.bodyAsText()).isEqualTo("hello world");
        }

        @Test
        void noHeadersNoBody() {
            var req = complete("GET / HTTP/1.1\r\n\r\n");
            assertThat(req.path()).isEqualTo("/");
            assertThat(req.headers()).isEmpty();
            assertThat(req.bodyLength()).isZero();
        }

        @Test
        void bareLF() {
            var req = complete("GET /a HTTP/1.0\nAccept: */*\n\n");
            assertThat(req.version()).isEqualTo("HTTP/1.0");
            assertThat(req.headers()).containsExactly(entry("Accept", "*/*"));
        }

        @Test
        void queryIsPartOfPath() {
            assertThat(complete("GET /search?q=1&b HTTP/1.1\r\n\r\n").path())
                    .isEqualTo("/search?q=1&b");
        }

        @Test
        void methodNotValidated() {
            assertThat(complete("BREW /pot HTCPCP/1.0\r\n\r\n").method())
                    .isEqualTo("BREW");
        }

        @Test
        void duplicateHeader_lastWins() {
            var req = complete("GET / HTTP/1.1\r\nX: 1\r\nY: 2\r\nX: 3\r\n\r\n");
            assertThat(req.headers()).containsExactly(
                    entry("X", "3"),
                    entry("Y", "2"));
        }

        @Test
        void headerNamesNotNormalized() {
            var req = complete("GET / HTTP/1.1\r\nhost: a\r\nHOST: b\r\n\r\n");
            assertThat(req.headers()).containsExactly(
                    entry("host", "a"),
                    entry("HOST", "b"));
        }

        @Test
        void headerValue_leadingBlanksStripped_restKept() {
            var req = complete("GET / HTTP/1.1\r\nA: \t v:w \r\nB:\r\n\r\n");
            assertThat(req.headers()).containsExactly(
                    entry("A", "v:w "),
                    entry("B", ""));
        }

        @Test
        void lineWithoutColon_dropped() {
            var req = complete("GET / HTTP/1.1\r\ngarbage\r\nA: 1\r\n\r\n");
            assertThat(req.headers()).containsExactly(entry("A", "1"));
        }

        @Test
        void lowercaseContentLength_isJustAHeader() {
            var req = complete("POST / HTTP/1.1\r\ncontent-length: 3\r\n\r\nabc");
            assertThat(req.bodyLength()).isZero();
        }

        @Test
        void extraBytes_ignored() {
            var req = complete("POST / HTTP/1.1\r\nContent-Length: 2\r\n\r\nabcdef");
            assertThat(req.bodyAsText()).isEqualTo("ab");
        }

        @Test
        void contentLengthPaddedWithBlanks() {
            var req = complete("POST / HTTP/1.1\r\nContent-Length:  3 \r\n\r\nabc");
            assertThat(req.bodyAsText()).isEqualTo("abc");
        }

        @Test
        void requestLineSurroundedByWhitespace() {
            var req = complete("  GET   /x   HTTP/1.1  \r\n\r\n");
            assertThat(req.method()).isEqualTo("GET");
            assertThat(req.path()).isEqualTo("/x");
        }

        @Test
        void onlyLengthIsParsed() {
            byte[] b = "GET / HTTP/1.1\r\n\r\nIGNORED".getBytes(ISO_8859_1);
            var res = RequestParser.parse(b, 18);
            assertThat(res.kind()).isEqualTo(COMPLETE);
        }
    }

    @Nested
    class Truncated {
        @Test
        void noBytes() {
            var res = parse("");
            assertThat(res.kind()).isEqualTo(TRUNCATED);
            assertThat(res.requiredLength()).isEqualTo(-1);
        }

        @Test
        void headNotTerminated() {
            var res = parse("GET / HTTP/1.1\r\nHost: x\r\n");
            assertThat(res.kind()).isEqualTo(TRUNCATED);
            assertThat(res.requiredLength()).isEqualTo(-1);
        }

        @Test
        void fewerBodyBytesThanDeclared() {
            String head = "POST / HTTP/1.1\r\nContent-Length: 5\r\n\r\n";
            var res = parse(head + "abc");
            assertThat(res.kind()).isEqualTo(TRUNCATED);
            assertThat(res.requiredLength()).isEqualTo(head.length() + 5);
            assertThat(res.error()).hasMessage("Expected 5 body bytes, have 3.");
        }

        @Test
        void requiredLengthCapped() {
            var res = parse("POST / HTTP/1.1\r\nContent-Length: 2147483647\r\n\r\n");
            assertThat(res.kind()).isEqualTo(TRUNCATED);
            assertThat(res.requiredLength()).isEqualTo(Integer.MAX_VALUE);
        }

        @Test
        void toMalformed() {
            var res = parse("GET /").toMalformed();
            assertThat(res.kind()).isEqualTo(MALFORMED);
            assertThat(res.error()).hasMessage("Request line not terminated.");
        }
    }

    @Nested
    class Malformed {
        @ParameterizedTest
        @ValueSource(strings = {
            "\r\n\r\n",
            "GET\r\n\r\n",
            "GET /\r\n\r\n",
            "GET / HTTP/1.1 extra\r\n\r\n"
        })
        void badRequestLine(String request) {
            var res = parse(request);
            assertThat(res.kind()).isEqualTo(MALFORMED);
            assertThat(res.error().position()).isZero();
            assertThat(res.error().getResponse().statusCode()).isEqualTo(400);
        }

        @Test
        void badRequestLine_detectedBeforeHeadIsComplete() {
            assertThat(parse("GET /\r\nHost: x\r\n").kind()).isEqualTo(MALFORMED);
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "-1", "+1", "1.0", "", "0x10", "2147483648", "1 2"})
        void badContentLength(String value) {
            var res = parse("POST / HTTP/1.1\r\nHost: x\r\nContent-Length: " + value + "\r\n\r\n");
            assertThat(res.kind()).isEqualTo(MALFORMED);
            assertThat(res.error().position()).isEqualTo("POST / HTTP/1.1\r\nHost: x\r\n".length());
        }
    }

    @Test
    void lengthOutOfBounds() {
        assertThatThrownBy(() -> RequestParser.parse(new byte[1], 2))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void recoversAllHeadersAndBody() {
        var sb = new StringBuilder("PUT /r HTTP/1.1\r\n");
        for (int i = 0; i < 20; ++i) {
            sb.append("H").append(i).append(": v").append(i).append("\r\n");
        }
        String body = "x".repeat(300);
        sb.append("Content-Length: ").append(body.length()).append("\r\n\r\n").append(body);
        var req = complete(sb.toString());
        assertThat(req.headers()).hasSize(21);
        assertThat(req.headers()).containsEntry("H7", "v7");
        assertThat(req.bodyAsText()).isEqualTo(body);
    }

    private static ParseResult parse(String request) {
        byte[] b = request.getBytes(ISO_8859_1);
        return RequestParser.parse(b, b.length);
    }

    private static Request complete(String request) {
        var res = parse(request);
        assertThat(res.kind()).isEqualTo(COMPLETE);
        return res.request();
    }
}

package alpha.tinyhttp.core.mediumtest;

import alpha.tinyhttp.testutil.functional.AbstractRealTest;
import alpha.tinyhttp.testutil.functional.HttpClientFacade;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static alpha.tinyhttp.testutil.TestClient.CRLF;
import static alpha.tinyhttp.testutil.TestClient.readTextUntilEOS;
import static alpha.tinyhttp.testutil.TestClient.write;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests concerning the message exchange; what the request handler sees of the
 * request, and what the client sees of the response.
 */
final class MessageTest extends AbstractRealTest
{
    @Test
    void echoBody() throws Exception {
        addEchoRoute();
        var rsp = client().writeReadTextUntilEOS(
            "POST /echo HTTP/1.1"   + CRLF +
            "Content-Length: 5"     + CRLF + CRLF +
            "hello");
        assertThat(rsp).isEqualTo(
            "HTTP/1.1 200 OK"           + CRLF +
            "Content-Type: text/plain"  + CRLF +
            "Content-Length: 5"         + CRLF + CRLF +
            "hello");
    }

    @Test
    void bodyArrivesLate() throws Exception {
        addEchoRoute();
        try (var ch = client().openConnection()) {
            write(ch, "POST /echo HTTP/1.1" + CRLF + "Content-Le");
            write(ch, "ngth: 3" + CRLF + CRLF);
            write(ch, "ab");
            write(ch, "c");
            assertThat(readTextUntilEOS(ch)).endsWith(CRLF + CRLF + "abc");
        }
    }

    @Test
    void methodAndHeaders() throws Exception {
        server().register("/what", (req, rsp) -> rsp.setContent(
                req.method() + " " + req.version() + " " +
                req.header("X-Thing").orElse("none"), "text/plain"));
        var rsp = client().writeReadTextUntilEOS(
            "BREW /what HTTP/1.0" + CRLF +
            "X-Thing:   teapot"   + CRLF + CRLF);
        assertThat(rsp).startsWith("HTTP/1.1 200 OK" + CRLF)
                       .endsWith(CRLF + CRLF + "BREW HTTP/1.0 teapot");
    }

    @Test
    void responseHeaderOrder() throws Exception {
        server().register("/", (req, rsp) -> rsp
                .setHeader("X-B", "2")
                .setHeader("X-A", "1")
                .setContent("body", "text/plain"));
        var rsp = client().writeReadTextUntilEOS("GET / HTTP/1.1" + CRLF + CRLF);
        assertThat(rsp).isEqualTo(
            "HTTP/1.1 200 OK"           + CRLF +
            "X-B: 2"                    + CRLF +
            "X-A: 1"                    + CRLF +
            "Content-Type: text/plain"  + CRLF +
            "Content-Length: 4"         + CRLF + CRLF +
            "body");
    }

    @Test
    void extraBytesIgnored() throws Exception {
        addEchoRoute();
        var rsp = client().writeShutdownReadTextUntilEOS(
            "POST /echo HTTP/1.1"   + CRLF +
            "Content-Length: 2"     + CRLF + CRLF +
            "okIGNORED");
        assertThat(rsp).endsWith(CRLF + CRLF + "ok");
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource
    void echoBody_compatibility(HttpClientFacade.Implementation impl) throws Exception {
        addEchoRoute();
        var rsp = impl.create(server()).postAndReceiveText("/echo", "Hello from a client");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body()).isEqualTo("Hello from a client");
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource
    void notFound_compatibility(HttpClientFacade.Implementation impl) throws Exception {
        var rsp = impl.create(server()).getText("/nope");
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.body()).isEqualTo(
            "<html><body><h1>404 Not Found</h1></body></html>");
        if (impl != HttpClientFacade.Implementation.JDK) {
            assertThat(rsp.reasonPhrase()).isEqualTo("Not Found");
        }
    }

    private void addEchoRoute() throws Exception {
        server().register("/echo", (req, rsp) ->
                rsp.setContent(req.body(), "text/plain"));
    }
}

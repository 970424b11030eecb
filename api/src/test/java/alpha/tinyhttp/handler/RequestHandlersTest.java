package alpha.tinyhttp.handler;

import alpha.tinyhttp.message.Request;
import alpha.tinyhttp.message.Response;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link RequestHandlers}.
 */
final class RequestHandlersTest
{
    private static final Request GET = new Request(
            "GET", "/", "HTTP/1.1", Map.of(), new byte[0]);

    @TempDir
    Path dir;

    @Test
    void content() throws Exception {
        var rsp = new Response();
        RequestHandlers.content("{\"a\":1}", "application/json").handle(GET, rsp);
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.header("Content-Type")).hasValue("application/json");
        assertThat(new String(rsp.body(), UTF_8)).isEqualTo("{\"a\":1}");
    }

    @Test
    void file_found() throws Exception {
        var f = Files.writeString(dir.resolve("style.css"), "body{}");
        var rsp = new Response();
        RequestHandlers.file(f).handle(GET, rsp);
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.header("Content-Type")).hasValue("text/css");
        assertThat(rsp.header("Content-Length")).hasValue("6");
        assertThat(new String(rsp.body(), UTF_8)).isEqualTo("body{}");
    }

    @Test
    void file_readAnewEachTime() throws Exception {
        var f = Files.writeString(dir.resolve("a.txt"), "v1");
        var h = RequestHandlers.file(f);
        var rsp1 = new Response();
        h.handle(GET, rsp1);
        Files.writeString(f, "version 2");
        var rsp2 = new Response();
        h.handle(GET, rsp2);
        assertThat(new String(rsp1.body(), UTF_8)).isEqualTo("v1");
        assertThat(new String(rsp2.body(), UTF_8)).isEqualTo("version 2");
    }

    @Test
    void file_missing() throws Exception {
        var rsp = new Response();
        RequestHandlers.file(dir.resolve("nope.html")).handle(GET, rsp);
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.statusMessage()).isEqualTo("Not Found");
        assertThat(new String(rsp.body(), UTF_8)).isEqualTo(
                "<html><body><h1>404 Not Found</h1></body></html>");
    }

    @Test
    void file_directory() throws Exception {
        var rsp = new Response();
        RequestHandlers.file(dir).handle(GET, rsp);
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.header("Content-Type")).hasValue("text/html");
    }

    @Test
    void file_parentIsNotDirectory() throws Exception {
        var f = Files.writeString(dir.resolve("a.txt"), "text");
        var rsp = new Response();
        RequestHandlers.file(f.resolve("b.txt")).handle(GET, rsp);
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.header("Content-Length")).hasValue("48");
    }
}

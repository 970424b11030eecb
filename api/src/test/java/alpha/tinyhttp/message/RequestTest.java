package alpha.tinyhttp.message;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Map.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Request}.
 */
final class RequestTest
{
    @Test
    void headersAreCopiedAndUnmodifiable() {
        Map<String, String> src = new LinkedHashMap<>();
        src.put("Host", "x");
        var req = new Request("GET", "/", "HTTP/1.1", src, new byte[0]);
        src.put("Other", "y");
        assertThat(req.headers()).containsExactly(entry("Host", "x"));
        assertThatThrownBy(() -> req.headers().clear())
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void body() {
        byte[] b = "héllo".getBytes(UTF_8);
        var req = new Request("POST", "/", "HTTP/1.1", Map.of(), b);
        b[0] = 'X';
        assertThat(req.bodyAsText()).isEqualTo("héllo");
        assertThat(req.bodyLength()).isEqualTo(6);
        req.body()[0] = 'Y';
        assertThat(req.body()[0]).isEqualTo((byte) 'h');
    }

    @Test
    void header_exactName() {
        var req = new Request("GET", "/", "HTTP/1.1", Map.of("Accept", "*/*"), new byte[0]);
        assertThat(req.header("Accept")).hasValue("*/*");
        assertThat(req.header("accept")).isEmpty();
    }

    @Test
    void equality() {
        var a = new Request("GET", "/", "HTTP/1.1", Map.of("k", "v"), new byte[]{1});
        var b = new Request("GET", "/", "HTTP/1.1", Map.of("k", "v"), new byte[]{1});
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(
                new Request("GET", "/", "HTTP/1.1", Map.of("k", "v"), new byte[]{2}));
    }
}

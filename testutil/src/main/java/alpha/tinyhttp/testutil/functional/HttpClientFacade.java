package alpha.tinyhttp.testutil.functional;

import alpha.tinyhttp.HttpServer;
import io.netty.buffer.ByteBufAllocator;
import io.netty.handler.codec.http.HttpMethod;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.RequestBody;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpVersion;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.util.StringRequestContent;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient.ResponseReceiver;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.IntFunction;

import static alpha.tinyhttp.HttpConstants.HeaderName.CONTENT_LENGTH;
import static alpha.tinyhttp.HttpConstants.Method.GET;
import static alpha.tinyhttp.HttpConstants.Method.POST;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Sends simple text exchanges through one of a few real-world HTTP clients.<p>
 *
 * Medium tests first verify the wire format using the {@code TestClient}, then
 * repeat the exchange through each {@link Implementation} to make sure the
 * clients people actually use understand the server:
 *
 * <pre>
 *   {@literal @}ParameterizedTest
 *   {@literal @}EnumSource
 *   void greeting_compatibility(HttpClientFacade.Implementation impl) {
 *       var rsp = impl.create(server()).getText("/");
 *       assertThat(rsp.statusCode()).isEqualTo(200);
 *   }
 * </pre>
 *
 * Every exchange uses HTTP/1.1 and a client created for that exchange alone.
 * Bodies are encoded and decoded as UTF-8.
 */
public abstract class HttpClientFacade
{
    /**
     * The client libraries.
     */
    public enum Implementation {
        /** {@code java.net.http.HttpClient}; exposes no reason phrase. */
        JDK (Jdk::new),
        /** OkHttp. */
        OKHTTP (OkHttp::new),
        /** Apache HttpClient 5, classic API. */
        APACHE (Apache::new),
        /** Jetty's HttpClient. */
        JETTY (Jetty::new),
        /** Reactor-Netty's HttpClient. */
        REACTOR (Reactor::new);

        private final IntFunction<HttpClientFacade> factory;

        Implementation(IntFunction<HttpClientFacade> factory) {
            this.factory = factory;
        }

        /**
         * Creates a facade connecting to the given server.
         *
         * @param server running
         * @return a client facade
         * @throws IllegalStateException if the server is not running
         */
        public HttpClientFacade create(HttpServer server) {
            return factory.apply(server.getPort());
        }
    }

    private final int port;

    HttpClientFacade(int port) {
        this.port = port;
    }

    /**
     * Sends a GET request.
     *
     * @param path of resource
     * @return the reply
     * @throws Exception from the client
     */
    public final Reply getText(String path) throws Exception {
        return send(GET, uri(path), null);
    }

    /**
     * Sends a POST request with a body and a declared Content-Length.
     *
     * @param path of resource
     * @param body of request
     * @return the reply
     * @throws Exception from the client
     */
    public final Reply postAndReceiveText(String path, String body) throws Exception {
        return send(POST, uri(path), body);
    }

    /**
     * Executes one exchange.
     *
     * @param method of request
     * @param uri of request
     * @param body of request, {@code null} if none
     * @return the reply
     * @throws Exception from the client
     */
    abstract Reply send(String method, URI uri, String body) throws Exception;

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + port + path);
    }

    /**
     * What a client received.<p>
     *
     * Headers are looked up case-insensitively.
     *
     * @param statusCode of response
     * @param reason phrase, {@code null} if the client does not expose it
     * @param headers of response
     * @param body of response, never {@code null}
     */
    public record Reply(
            int statusCode, String reason,
            Map<String, List<String>> headers, String body)
    {
        /**
         * Creates a reply.
         */
        public Reply {
            var copy = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
            copy.putAll(headers);
            headers = copy;
            body = body == null ? "" : body;
        }

        /**
         * {@return the reason phrase}
         *
         * @throws UnsupportedOperationException
         *             if the client does not expose the reason phrase
         */
        public String reasonPhrase() {
            if (reason == null) {
                throw new UnsupportedOperationException();
            }
            return reason;
        }

        /**
         * {@return the first value of the named header}
         *
         * @param name of header
         */
        public Optional<String> header(String name) {
            var values = headers.get(name);
            return values == null || values.isEmpty() ?
                    Optional.empty() : Optional.of(values.get(0));
        }
    }

    private static void add(Map<String, List<String>> headers, String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value);
    }

    private static final class Jdk extends HttpClientFacade {
        Jdk(int port) {
            super(port);
        }

        @Override
        Reply send(String method, URI uri, String body) throws IOException, InterruptedException {
            var req = HttpRequest.newBuilder(uri)
                    .method(method, body == null ?
                            HttpRequest.BodyPublishers.noBody() :
                            HttpRequest.BodyPublishers.ofString(body))
                    .build();
            var rsp = java.net.http.HttpClient.newBuilder()
                    .version(java.net.http.HttpClient.Version.HTTP_1_1)
                    .build()
                    .send(req, HttpResponse.BodyHandlers.ofString(UTF_8));
            return new Reply(rsp.statusCode(), null, rsp.headers().map(), rsp.body());
        }
    }

    private static final class OkHttp extends HttpClientFacade {
        OkHttp(int port) {
            super(port);
        }

        @Override
        Reply send(String method, URI uri, String body) throws IOException {
            var req = new okhttp3.Request.Builder()
                    .url(uri.toURL())
                    .method(method, body == null ? null : RequestBody.create(body, null))
                    .build();
            var cli = new OkHttpClient.Builder()
                    .protocols(List.of(Protocol.HTTP_1_1))
                    .build();
            try (var rsp = cli.newCall(req).execute()) {
                var content = rsp.body();
                return new Reply(rsp.code(), rsp.message(),
                        rsp.headers().toMultimap(),
                        content == null ? null : content.string());
            }
        }
    }

    private static final class Apache extends HttpClientFacade {
        Apache(int port) {
            super(port);
        }

        @Override
        Reply send(String method, URI uri, String body) throws IOException {
            var req = new HttpUriRequestBase(method, uri);
            req.setVersion(HttpVersion.HTTP_1_1);
            if (body != null) {
                req.setEntity(new StringEntity(body, ContentType.TEXT_PLAIN.withCharset(UTF_8)));
            }
            try (var cli = HttpClients.createDefault()) {
                return cli.execute(req, rsp -> {
                    Map<String, List<String>> headers = new TreeMap<>();
                    for (var h : rsp.getHeaders()) {
                        add(headers, h.getName(), h.getValue());
                    }
                    var entity = rsp.getEntity();
                    return new Reply(rsp.getCode(), rsp.getReasonPhrase(), headers,
                            entity == null ? null : EntityUtils.toString(entity, UTF_8));
                });
            }
        }
    }

    private static final class Jetty extends HttpClientFacade {
        Jetty(int port) {
            super(port);
        }

        @Override
        Reply send(String method, URI uri, String body) throws Exception {
            var cli = new org.eclipse.jetty.client.HttpClient();
            cli.start();
            ContentResponse rsp;
            try {
                var req = cli.newRequest(uri)
                        .method(method)
                        .version(org.eclipse.jetty.http.HttpVersion.HTTP_1_1);
                if (body != null) {
                    req.body(new StringRequestContent("text/plain", body, UTF_8));
                }
                rsp = req.send();
            } finally {
                cli.stop();
            }
            Map<String, List<String>> headers = new TreeMap<>();
            rsp.getHeaders().forEach(f -> add(headers, f.getName(), f.getValue()));
            return new Reply(rsp.getStatus(), rsp.getReason(), headers,
                    rsp.getContentAsString());
        }
    }

    private static final class Reactor extends HttpClientFacade {
        Reactor(int port) {
            super(port);
        }

        @Override
        Reply send(String method, URI uri, String body) {
            var cli = reactor.netty.http.client.HttpClient.create()
                    .protocol(HttpProtocol.HTTP11);
            if (body != null) {
                // Reactor goes chunked unless told the length
                int length = body.getBytes(UTF_8).length;
                cli = cli.headers(h -> h.set(CONTENT_LENGTH, length));
            }
            var sender = cli.request(HttpMethod.valueOf(method)).uri(uri);
            ResponseReceiver<?> receiver = body == null ? sender : sender.send(
                    ByteBufFlux.fromString(Mono.just(body), UTF_8, ByteBufAllocator.DEFAULT));
            return receiver.responseSingle((head, content) -> content
                    .asString(UTF_8)
                    .defaultIfEmpty("")
                    .map(text -> {
                        Map<String, List<String>> headers = new TreeMap<>();
                        head.responseHeaders().forEach(e -> add(headers, e.getKey(), e.getValue()));
                        return new Reply(head.status().code(),
                                head.status().reasonPhrase(), headers, text);
                    }))
                    .block();
        }
    }
}

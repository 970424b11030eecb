package alpha.tinyhttp.examples;

import alpha.tinyhttp.HttpServer;
import alpha.tinyhttp.handler.RequestHandlers;
import alpha.tinyhttp.route.Router;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serves a greeting, a piece of JSON and a static file.<p>
 *
 * Routes:
 * <ul>
 *   <li>"/" responds an HTML greeting.</li>
 *   <li>"/api/data" responds {@value #JSON} as "application/json".</li>
 *   <li>"/index.html" responds the file "index.html" in the static
 *       directory, or "404 Not Found" if the file does not exist.</li>
 * </ul>
 *
 * The first program argument is the port (default 8080), the second the
 * static directory (default "public").
 */
public final class HelloWorld
{
    /** Response body of "/". */
    public static final String GREETING =
            "<html><body><h1>Hello, World!</h1>" +
            "<p>Welcome to the TinyHTTP server</p></body></html>";

    /** Response body of "/api/data". */
    public static final String JSON = "{\"message\": \"This is JSON data\"}";

    private HelloWorld() {
        // Empty
    }

    /**
     * Application's entry point.
     *
     * @param args port, static directory (both optional)
     *
     * @throws IOException
     *             if the server can not bind
     * @throws NumberFormatException
     *             if the port argument is not a number
     */
    public static void main(String... args) throws IOException {
        int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
        Path dir = Path.of(args.length > 1 ? args[1] : "public");

        HttpServer app = HttpServer.create();
        addRoutes(app, dir);

        System.out.println("Starting server on port " + port + "...");
        app.start(port);
    }

    /**
     * Registers the routes of this application.
     *
     * @param router to register routes with
     * @param staticDir directory of "index.html"
     */
    public static void addRoutes(Router router, Path staticDir) {
        // Response.setContent(String) defaults to text/html
        router.register("/", (req, rsp) -> rsp.setContent(GREETING));
        router.register("/api/data", RequestHandlers.content(JSON, "application/json"));
        router.register("/index.html", RequestHandlers.file(staticDir.resolve("index.html")));
    }
}

package alpha.tinyhttp.core;

import alpha.tinyhttp.handler.RequestHandler;
import alpha.tinyhttp.route.Router;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Router}.<p>
 *
 * The table is an immutable map, replaced by a modified copy on each
 * registration. Lookups read the current map without locking.
 */
class DefaultRouter implements Router
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouter.class.getPackageName());

    private final AtomicReference<Map<String, RequestHandler>> table;

    DefaultRouter() {
        table = new AtomicReference<>(Map.of());
    }

    @Override
    public DefaultRouter register(String path, RequestHandler handler) {
        requireNonNull(path);
        requireNonNull(handler);
        var old = table.getAndUpdate(m -> copyAnd(m, c -> c.put(path, handler)));
        LOG.log(DEBUG, () -> (old.containsKey(path) ? "Replaced" : "Registered") +
                " handler for path \"" + path + "\".");
        return this;
    }

    @Override
    public Optional<RequestHandler> unregister(String path) {
        requireNonNull(path);
        var old = table.getAndUpdate(m -> m.containsKey(path) ?
                copyAnd(m, c -> c.remove(path)) : m);
        return Optional.ofNullable(old.get(path));
    }

    @Override
    public Optional<RequestHandler> dispatch(String path) {
        return Optional.ofNullable(table.get().get(requireNonNull(path)));
    }

    private static Map<String, RequestHandler> copyAnd(
            Map<String, RequestHandler> m,
            Consumer<Map<String, RequestHandler>> modifier) {
        var c = new HashMap<>(m);
        modifier.accept(c);
        return Collections.unmodifiableMap(c);
    }
}

package alpha.tinyhttp.core;

import alpha.tinyhttp.util.Throwing;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

import static java.lang.Thread.currentThread;
import static java.util.Objects.requireNonNull;

/**
 * A box of a value with a confined life cycle.<p>
 *
 * The value can be initialized once, and dropped once. Both operations are
 * executed by only one thread; a thread racing for the same operation
 * observes a no-op. After the value has been dropped, it can not be
 * initialized again.<p>
 *
 * This class is used by the server to manage the listening channel.
 *
 * @param <V> value type
 */
final class Confined<V>
{
    Confined() {
        // Empty
    }

    private final AtomicReference<Object> ref = new AtomicReference<>();

    private static final class Reservation {
        final long threadId;
        final Object previousVal;

        Reservation(long threadId, Object previousVal) {
            this.threadId = threadId;
            this.previousVal = previousVal;
        }

        boolean isMine() {
            return threadId == currentThread().getId();
        }
    }

    private static final Reservation
            DROPPED = new Reservation(-1, null);

    private static final Predicate<Object>
            IS_USER_VALUE = o -> o != null && !(o instanceof Reservation);

    /**
     * Initializes the value, if the box has never been initialized before.<p>
     *
     * If the factory throws, the box becomes dropped.
     *
     * @param factory of value
     * @param <X> factory's exception type
     * @return the value, or {@code null} if it was not initialized by this call
     * @throws X from factory
     */
    <X extends Exception> V initThrowsX(Throwing.Supplier<? extends V, X> factory) throws X {
        requireNonNull(factory);
        Predicate<Object> mustNotBeSetToAnything = Objects::isNull;
        var v1 = reserve(mustNotBeSetToAnything);
        V v2 = null;
        if (v1 instanceof Reservation && ((Reservation) v1).isMine()) {
            try {
                v2 = requireNonNull(factory.get());
            } catch (Throwable t) {
                ref.set(DROPPED);
                throw t;
            }
            ref.set(v2);
        }
        return v2;
    }

    /**
     * {@return {@code true} if a value is present}
     */
    boolean isPresent() {
        return IS_USER_VALUE.test(ref.get());
    }

    /**
     * {@return the value, if present}
     */
    Optional<V> peek() {
        Object o = ref.get();
        if (IS_USER_VALUE.test(o)) {
            @SuppressWarnings("unchecked")
            V v = (V) o;
            return Optional.of(v);
        }
        return Optional.empty();
    }

    /**
     * Drops the value, if present.<p>
     *
     * The value is removed from the box before the disposer is called.
     *
     * @param disposer of value
     * @param <X> disposer's exception type
     * @return {@code true} if this call dropped the value
     * @throws X from disposer
     */
    <X extends Exception> boolean dropThrowsX(Throwing.Consumer<? super V, X> disposer) throws X {
        requireNonNull(disposer);
        var v1 = reserve(IS_USER_VALUE);
        if (v1 instanceof Reservation && ((Reservation) v1).isMine()) {
            ref.set(DROPPED);
            @SuppressWarnings("unchecked")
            V v = (V) ((Reservation) v1).previousVal;
            disposer.accept(v);
            return true;
        }
        return false;
    }

    private Object reserve(Predicate<Object> when) {
        return ref.updateAndGet(v -> when.test(v) ?
                new Reservation(currentThread().getId(), v) :
                v);
    }
}

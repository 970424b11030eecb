package alpha.tinyhttp.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Provides a convenient baseclass for immutable builder implementations.<p>
 *
 * Builders are backwards-linked in a chain and the only real state they each
 * store is a modifying action, which is replayed against a mutable state
 * container during {@link #constructState(Supplier) construction time}.<p>
 *
 * Any builder in the chain can be used as a template for a new branch, without
 * affecting builders derived from it before.
 *
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;

    /**
     * Construct an {@code AbstractImmutableBuilder} root.
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }

    /**
     * Construct an {@code AbstractImmutableBuilder} leaf.
     *
     * @param prev previous builder
     * @param modifier action to apply on mutable state
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }

    /**
     * Construct the mutable state container and play all modifiers against
     * it, oldest first.<p>
     *
     * The concrete builder's {@code build()} method is expected to call this
     * method and transfer the state to the constructor of the built object.
     *
     * @param factory of state
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();

        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }

        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}

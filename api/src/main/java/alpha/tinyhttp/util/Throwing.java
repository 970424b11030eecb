package alpha.tinyhttp.util;

/**
 * Functional interfaces that may throw a checked exception.
 */
public final class Throwing {
    private Throwing() {
        // Empty
    }

    /**
     * A {@link java.lang.Runnable} that may throw.
     *
     * @param <X> exception type
     */
    @FunctionalInterface
    public interface Runnable<X extends Exception> {
        /**
         * Run.
         *
         * @throws X if something goes wrong
         */
        void run() throws X;
    }

    /**
     * A {@link java.util.function.Consumer} that may throw.
     *
     * @param <T> type of argument
     * @param <X> exception type
     */
    @FunctionalInterface
    public interface Consumer<T, X extends Exception> {
        /**
         * Accept.
         *
         * @param t the argument
         * @throws X if something goes wrong
         */
        void accept(T t) throws X;
    }

    /**
     * A {@link java.util.function.Supplier} that may throw.
     *
     * @param <T> type of result
     * @param <X> exception type
     */
    @FunctionalInterface
    public interface Supplier<T, X extends Exception> {
        /**
         * Get.
         *
         * @return a result
         * @throws X if something goes wrong
         */
        T get() throws X;
    }
}

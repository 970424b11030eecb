package alpha.tinyhttp.util;

import java.io.Closeable;

/**
 * Util methods that have nowhere else to go.
 */
public final class Blah
{
    private Blah() {
        // Empty
    }

    /**
     * Runs a method, or closes a resource if the method throws.<p>
     *
     * Any exception from closing the resource is suppressed by the exception
     * from the method, which is then rethrown.
     *
     * @param method to run
     * @param resource to close on failure
     * @param <X> method's exception type
     * @throws X from method
     */
    public static <X extends Exception> void runOrClose(
          Throwing.Runnable<X> method,
          Closeable resource)
          throws X
    {
        try {
            method.run();
        } catch (Throwable fromMethod) {
            try {
                resource.close();
            } catch (Throwable fromClose) {
                fromMethod.addSuppressed(fromClose);
            }
            throw fromMethod;
        }
    }
}

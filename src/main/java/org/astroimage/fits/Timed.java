package org.astroimage.fits;

import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs how long decoding, analysis and demosaicing take, at FINE.
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());

    private Timed() {
    }

    /**
     * Run an operation and log its duration. The elapsed milliseconds are
     * passed as the last format argument, so the format should end with a
     * {@code %d}. Exceptions thrown by the operation, checked ones included,
     * pass through unchanged.
     *
     * @param operation The work to time
     * @param format A {@link String#format} message
     * @param args Arguments for the message, before the elapsed time
     * @return The result of the operation
     */
    public static <T> T execute(Callable<T> operation, String format, Object... args) {
        long start = System.nanoTime();
        try {
            return operation.call();
        } catch (Exception x) {
            throw Timed.<RuntimeException>rethrow(x);
        } finally {
            if (LOG.isLoggable(Level.FINE)) {
                Object[] withElapsed = Arrays.copyOf(args, args.length + 1);
                withElapsed[args.length] = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                LOG.fine(String.format(format, withElapsed));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <X extends Exception> X rethrow(Exception x) throws X {
        throw (X) x;
    }
}

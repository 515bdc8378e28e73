package org.astroimage.fits;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A lazy one-to-one mapping over a sequence of inputs, evaluated one element
 * per call to {@link #next()}. The first failure is rethrown to the caller and
 * ends the sequence: after it {@link #hasNext()} returns false. Checked
 * {@link IOException}s are rethrown wrapped in {@link UncheckedIOException}.
 *
 * @param <S> The input type
 * @param <T> The result type
 */
public class BatchIterator<S, T> implements Iterator<T>, Iterable<T> {

    @FunctionalInterface
    public interface Step<S, T> {

        T apply(S source) throws IOException;
    }

    private final Iterator<? extends S> sources;
    private final Step<? super S, ? extends T> step;
    private boolean failed;

    public BatchIterator(Iterator<? extends S> sources, Step<? super S, ? extends T> step) {
        this.sources = sources;
        this.step = step;
    }

    @Override
    public boolean hasNext() {
        return !failed && sources.hasNext();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        S source = sources.next();
        try {
            return step.apply(source);
        } catch (IOException x) {
            failed = true;
            throw new UncheckedIOException(x);
        } catch (RuntimeException x) {
            failed = true;
            throw x;
        }
    }

    @Override
    public Iterator<T> iterator() {
        return this;
    }
}

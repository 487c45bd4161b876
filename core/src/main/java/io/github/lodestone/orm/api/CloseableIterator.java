package io.github.lodestone.orm.api;

import java.util.Iterator;

/**
 * An iterator over an open cursor. It closes itself once exhausted; callers that stop early must close it.
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {
    @Override
    void close();
}

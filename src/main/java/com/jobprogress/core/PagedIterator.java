package com.jobprogress.core;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterator that pulls its elements from the store one page at a time.
 *
 * <p>Subclasses keep their own cursor and return an empty page once enumeration is
 * finished. No page is fetched before the first call to {@link #hasNext()}.</p>
 *
 * @param <T> element type
 */
abstract class PagedIterator<T> implements Iterator<T> {
    private Iterator<T> page = Collections.emptyIterator();
    private boolean exhausted;

    /**
     * Fetch the next page and advance the cursor past it.
     *
     * @return the next elements, empty when there are no more
     */
    protected abstract List<T> nextPage();

    @Override
    public boolean hasNext() {
        if (!page.hasNext() && !exhausted) {
            List<T> next = nextPage();
            if (next.isEmpty()) {
                exhausted = true;
            } else {
                page = next.iterator();
            }
        }
        return page.hasNext();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return page.next();
    }
}

package com.phillippitts.blast.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity history of non-null elements. Adding to a full history evicts the oldest element.
 * Thread-safe; all operations synchronize on the instance and never block on I/O.
 *
 * @param <T> element type
 */
public final class BoundedHistory<T> {

    private final int capacity;
    private final ArrayDeque<T> elements;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void add(T element) {
        Objects.requireNonNull(element, "element");
        if (elements.size() == capacity) {
            elements.pollFirst();
        }
        elements.addLast(element);
    }

    public synchronized int size() {
        return elements.size();
    }

    /** Oldest first. */
    public synchronized List<T> snapshot() {
        return new ArrayList<>(elements);
    }

    /**
     * Up to {@code count} most recent elements, oldest first.
     */
    public synchronized List<T> last(int count) {
        int n = Math.max(0, Math.min(count, elements.size()));
        List<T> out = new ArrayList<>(n);
        Iterator<T> newestFirst = elements.descendingIterator();
        for (int i = 0; i < n; i++) {
            out.add(newestFirst.next());
        }
        Collections.reverse(out);
        return out;
    }

    public synchronized void clear() {
        elements.clear();
    }
}

package com.ivamare.reliability.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed-capacity circular buffer keyed by insertion order.
 *
 * <p>Once full, each append overwrites the oldest slot. All methods are
 * synchronized; readers get copies, never views into the buffer.
 *
 * @param <T> element type
 */
public final class BoundedHistory<T> {

    private final Object[] slots;
    private long appended;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.slots = new Object[capacity];
    }

    public synchronized void add(T element) {
        slots[(int) (appended % slots.length)] = element;
        appended++;
    }

    public synchronized int size() {
        return (int) Math.min(appended, slots.length);
    }

    public int capacity() {
        return slots.length;
    }

    /**
     * Total number of elements ever appended, including evicted ones.
     */
    public synchronized long totalAppended() {
        return appended;
    }

    public synchronized boolean isEmpty() {
        return appended == 0;
    }

    /**
     * All retained elements, oldest first.
     */
    public synchronized List<T> snapshot() {
        return lastN(slots.length);
    }

    /**
     * The newest {@code n} elements, oldest first.
     */
    @SuppressWarnings("unchecked")
    public synchronized List<T> lastN(int n) {
        int size = size();
        int count = Math.min(Math.max(n, 0), size);
        if (count == 0) {
            return Collections.emptyList();
        }
        List<T> result = new ArrayList<>(count);
        long start = appended - count;
        for (long i = start; i < appended; i++) {
            result.add((T) slots[(int) (i % slots.length)]);
        }
        return result;
    }

    /**
     * Retained elements matching the filter, oldest first.
     */
    public synchronized List<T> filter(Predicate<? super T> predicate) {
        List<T> result = new ArrayList<>();
        for (T element : snapshot()) {
            if (predicate.test(element)) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * Newest element, or null when empty.
     */
    @SuppressWarnings("unchecked")
    public synchronized T latest() {
        if (appended == 0) {
            return null;
        }
        return (T) slots[(int) ((appended - 1) % slots.length)];
    }

    public synchronized void clear() {
        java.util.Arrays.fill(slots, null);
        appended = 0;
    }
}

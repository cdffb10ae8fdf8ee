package com.example.pulsemonitor.storage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Fixed-capacity ring buffer of timestamped entries. Appending past capacity
 * overwrites the oldest slot. Readers always get a copy, so they never see a
 * half-applied append or purge.
 */
public class BoundedTimeSeries<T> {

    private final String name;
    private final int capacity;
    private final Function<T, Instant> timestampOf;
    private final Object[] slots;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private int head;
    private int size;

    public BoundedTimeSeries(String name, int capacity, Function<T, Instant> timestampOf) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.timestampOf = timestampOf;
        this.slots = new Object[capacity];
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Append all entries in order.
     *
     * @return number of older entries evicted to make room
     */
    public int appendAll(List<T> entries) {
        lock.writeLock().lock();
        try {
            int evicted = 0;
            for (T entry : entries) {
                int tail = (head + size) % capacity;
                slots[tail] = entry;
                if (size == capacity) {
                    head = (head + 1) % capacity;
                    evicted++;
                } else {
                    size++;
                }
            }
            return evicted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop every entry with a timestamp before the cutoff, wherever it sits.
     *
     * @return number of entries removed
     */
    public int purgeOlderThan(Instant cutoff) {
        lock.writeLock().lock();
        try {
            List<T> kept = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                T entry = at(i);
                if (!timestampOf.apply(entry).isBefore(cutoff)) {
                    kept.add(entry);
                }
            }
            int removed = size - kept.size();
            if (removed > 0) {
                Arrays.fill(slots, null);
                for (int i = 0; i < kept.size(); i++) {
                    slots[i] = kept.get(i);
                }
                head = 0;
                size = kept.size();
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<T> snapshot() {
        return filter(entry -> true);
    }

    /**
     * Entries whose timestamp lies within [start, end], oldest first.
     */
    public List<T> range(Instant start, Instant end) {
        return filter(entry -> {
            Instant ts = timestampOf.apply(entry);
            return !ts.isBefore(start) && !ts.isAfter(end);
        });
    }

    /**
     * The newest {@code n} entries, oldest first.
     */
    public List<T> latest(int n) {
        lock.readLock().lock();
        try {
            int count = Math.max(0, Math.min(n, size));
            List<T> result = new ArrayList<>(count);
            for (int i = size - count; i < size; i++) {
                result.add(at(i));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<T> filter(Predicate<T> predicate) {
        lock.readLock().lock();
        try {
            List<T> result = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                T entry = at(i);
                if (predicate.test(entry)) {
                    result.add(entry);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private T at(int logicalIndex) {
        return (T) slots[(head + logicalIndex) % capacity];
    }
}

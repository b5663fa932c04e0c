package io.avery.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Slot storage addressed by generation-checked {@link Index} handles.
 *
 * <p>Values live in a flat array of slots. Removing a value frees its slot for reuse and advances the slot's
 * generation, so every handle issued for the removed value stops resolving - a reused slot is never mistaken for the
 * value that used to live there. Growing the arena copies the slots into larger arrays; handles stay valid across
 * growth because they name slots, not array instances.
 *
 * <p>This class is not thread-safe.
 *
 * @param <T> the type of stored values
 */
public class GenerationalArena<T> {
    private static final Logger log = LoggerFactory.getLogger(GenerationalArena.class);
    
    static final int DEFAULT_CAPACITY = 4;
    private static final int NO_SLOT = -1;
    
    // A slot is free iff its value is null. Free slots form a singly-linked list through nextFree.
    private Object[] values;
    private long[] generations;
    private int[] nextFree;
    private int freeHead;
    private int size;
    
    public GenerationalArena() {
        this(DEFAULT_CAPACITY);
    }
    
    public GenerationalArena(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Illegal capacity: " + initialCapacity);
        }
        int capacity = Math.max(initialCapacity, 1);
        values = new Object[capacity];
        generations = new long[capacity];
        nextFree = new int[capacity];
        freeHead = NO_SLOT;
        chainFree(0, capacity);
    }
    
    /**
     * A pair of lookups made together, as returned by {@link #getPair}. Either side is {@code null} if its handle did
     * not resolve.
     */
    public record Pair<T>(T first, T second) { }
    
    /**
     * Stores a value, doubling the capacity first if every slot is occupied.
     *
     * @param value the value to store
     * @return a handle to the stored value
     */
    public Index insert(T value) {
        Objects.requireNonNull(value);
        if (freeHead == NO_SLOT) {
            reserve(values.length);
        }
        return store(value);
    }
    
    /**
     * Stores a value if a free slot is available, without growing.
     *
     * @param value the value to store
     * @return the handle of the stored value, or the value itself if the arena is full
     */
    public Insertion<T> tryInsert(T value) {
        Objects.requireNonNull(value);
        if (freeHead == NO_SLOT) {
            return Insertion.rejected(value);
        }
        return Insertion.inserted(store(value));
    }
    
    /**
     * Removes the value at the given handle, freeing its slot.
     *
     * @param index the handle to remove
     * @return the removed value, or {@code null} if the handle did not resolve
     */
    public T remove(Index index) {
        T value = get(index);
        if (value == null) {
            return null;
        }
        int slot = index.slot();
        values[slot] = null;
        generations[slot]++;
        nextFree[slot] = freeHead;
        freeHead = slot;
        size--;
        return value;
    }
    
    /**
     * Returns the value at the given handle, or {@code null} if the handle is stale or out of range.
     */
    @SuppressWarnings("unchecked")
    public T get(Index index) {
        int slot = index.slot();
        if (slot < 0 || slot >= values.length || generations[slot] != index.generation()) {
            return null;
        }
        return (T) values[slot];
    }
    
    public boolean contains(Index index) {
        return get(index) != null;
    }
    
    /**
     * Looks up two values that must live in different slots.
     *
     * @throws IllegalArgumentException if both handles name the same slot
     */
    public Pair<T> getPair(Index first, Index second) {
        if (first.slot() == second.slot()) {
            throw new IllegalArgumentException("Handles share slot " + first.slot() + ": " + first + ", " + second);
        }
        return new Pair<>(get(first), get(second));
    }
    
    public int size() {
        return size;
    }
    
    public int capacity() {
        return values.length;
    }
    
    /**
     * Adds room for {@code additional} more values.
     */
    public void reserve(int additional) {
        if (additional < 0) {
            throw new IllegalArgumentException("Illegal reservation: " + additional);
        }
        if (additional == 0) {
            return;
        }
        int oldCapacity = values.length;
        int newCapacity = oldCapacity + additional;
        if (newCapacity < 0) {
            throw new OutOfMemoryError("Required capacity " + oldCapacity + " + " + additional + " is too large");
        }
        log.debug("Growing arena capacity from {} to {}", oldCapacity, newCapacity);
        values = Arrays.copyOf(values, newCapacity);
        generations = Arrays.copyOf(generations, newCapacity);
        nextFree = Arrays.copyOf(nextFree, newCapacity);
        chainFree(oldCapacity, newCapacity);
    }
    
    /**
     * Removes every value, keeping the current capacity. Every previously issued handle stops resolving.
     */
    public void clear() {
        int capacity = values.length;
        for (int i = 0; i < capacity; i++) {
            if (values[i] != null) {
                values[i] = null;
                generations[i]++;
            }
        }
        size = 0;
        freeHead = NO_SLOT;
        chainFree(0, capacity);
    }
    
    private Index store(T value) {
        int slot = freeHead;
        freeHead = nextFree[slot];
        values[slot] = value;
        size++;
        return new Index(slot, generations[slot]);
    }
    
    // Prepends slots [from, to) to the free list, lowest slot first.
    private void chainFree(int from, int to) {
        for (int i = to - 1; i >= from; i--) {
            nextFree[i] = freeHead;
            freeHead = i;
        }
    }
}

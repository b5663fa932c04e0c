package io.avery.tree;

/**
 * The outcome of an insertion that is not allowed to grow storage, such as {@link Tree#tryInsert}.
 *
 * <p>Either the value was stored ({@link Inserted}), or storage was full and the value is handed back untouched
 * ({@link Rejected}). A rejected insertion can be retried after reserving more capacity.
 *
 * @param <T> the type of the inserted value
 */
public sealed interface Insertion<T> permits Insertion.Inserted, Insertion.Rejected {
    static <T> Insertion<T> inserted(Index index) {
        return new Inserted<>(index);
    }
    
    static <T> Insertion<T> rejected(T value) {
        return new Rejected<>(value);
    }
    
    boolean isInserted();
    
    /**
     * Returns the index of the stored value.
     *
     * @throws IllegalStateException if the insertion was rejected
     */
    Index index();
    
    /**
     * Returns the value that could not be stored.
     *
     * @throws IllegalStateException if the insertion succeeded
     */
    T rejectedValue();
    
    record Inserted<T>(Index index) implements Insertion<T> {
        @Override
        public boolean isInserted() {
            return true;
        }
        
        @Override
        public T rejectedValue() {
            throw new IllegalStateException("Value was inserted at " + index);
        }
    }
    
    record Rejected<T>(T value) implements Insertion<T> {
        @Override
        public boolean isInserted() {
            return false;
        }
        
        @Override
        public Index index() {
            throw new IllegalStateException("Insertion was rejected: capacity exhausted");
        }
        
        @Override
        public T rejectedValue() {
            return value;
        }
    }
}

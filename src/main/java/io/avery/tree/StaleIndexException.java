package io.avery.tree;

import java.util.NoSuchElementException;

/**
 * Thrown when an {@link Index} that no longer resolves to a live node is used where liveness is assumed.
 */
public class StaleIndexException extends NoSuchElementException {
    private final transient Index index;
    
    public StaleIndexException(Index index) {
        super("No live node at " + index);
        this.index = index;
    }
    
    public Index index() {
        return index;
    }
}

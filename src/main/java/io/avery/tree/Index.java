package io.avery.tree;

/**
 * A handle to a value stored in a {@link GenerationalArena}, and so to a node of an {@link ArenaTree}.
 *
 * <p>An {@code Index} names a storage slot together with the generation the slot had when the value was inserted.
 * Once that value is removed the slot's generation advances, and the handle no longer resolves to anything - even if
 * the slot is later reused for a different value.
 *
 * @param slot the position of the value in the arena
 * @param generation the generation of the slot at insertion time
 */
public record Index(int slot, long generation) {
    @Override
    public String toString() {
        return "Index(" + slot + "v" + generation + ")";
    }
}

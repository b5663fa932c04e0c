package io.avery.tree;

/**
 * An edge of a depth-first walk over a subtree, as produced by {@link Tree#traverse}.
 *
 * <p>Each node in the subtree is reported twice: a {@link Start} edge before any of its descendants, and an
 * {@link End} edge after all of them. Depths are relative to the node the walk started from.
 */
public sealed interface NodeEdge permits NodeEdge.Start, NodeEdge.End {
    Index index();
    
    int depth();
    
    record Start(Index index, int depth) implements NodeEdge { }
    
    record End(Index index, int depth) implements NodeEdge { }
}

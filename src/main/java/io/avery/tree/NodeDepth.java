package io.avery.tree;

/**
 * A node visited by {@link Tree#descendantsWithDepth}, with its depth below the node the traversal started from.
 *
 * @param index the visited node
 * @param depth 0 for the traversal root, 1 for its children, and so on
 */
public record NodeDepth(Index index, int depth) { }

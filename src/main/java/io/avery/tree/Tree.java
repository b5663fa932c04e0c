package io.avery.tree;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * An n-ary tree whose nodes are addressed by {@link Index} handles rather than by references.
 *
 * <p>A handle stays valid for as long as its node lives. Once a node is removed - directly, or because one of its
 * ancestors was removed - every handle to it becomes stale: fallible methods report it as absent, and methods that
 * assume liveness throw {@link StaleIndexException}. A stale handle never resolves to some other node.
 *
 * <p>Nodes may exist without a parent. At most one node may be designated the root of the tree, via
 * {@link #insertRoot}; the root can never be appended below another node.
 *
 * <p>Traversal methods return lazy {@code Iterable}s that restart on each call to {@code iterator()}. Modifying the
 * tree while iterating never throws or loops, but may end the iteration early.
 *
 * @param <T> the type of node payloads
 */
public interface Tree<T> {
    /**
     * Returns the number of nodes the tree can hold before it needs to grow.
     */
    int capacity();
    
    /**
     * Makes room for at least {@code additional} more nodes, so that {@link #tryInsert} succeeds for them.
     *
     * @param additional the number of extra nodes to make room for
     */
    void reserve(int additional);
    
    /**
     * Removes every node, keeping the current capacity. Every previously issued handle becomes stale.
     */
    void clear();
    
    /**
     * Returns the number of live nodes, attached or not.
     */
    int size();
    
    default boolean isEmpty() {
        return size() == 0;
    }
    
    /**
     * Adds an unattached node, growing the tree if it is full.
     *
     * @param data the payload of the new node
     * @return the handle of the new node
     */
    Index insert(T data);
    
    /**
     * Adds a node as the last child of {@code parent}, growing the tree if it is full.
     *
     * @param data the payload of the new node
     * @param parent the node to append to
     * @return the handle of the new node
     * @throws StaleIndexException if {@code parent} is stale
     */
    Index insert(T data, Index parent);
    
    /**
     * Like {@link #insert(Object)}, but never grows the tree. If it is full, the payload is handed back in an
     * {@link Insertion.Rejected} and the caller may {@link #reserve} and retry.
     *
     * @param data the payload of the new node
     * @return the outcome of the insertion
     */
    Insertion<T> tryInsert(T data);
    
    /**
     * Like {@link #insert(Object, Index)}, but never grows the tree.
     *
     * @param data the payload of the new node
     * @param parent the node to append to
     * @return the outcome of the insertion
     * @throws StaleIndexException if {@code parent} is stale
     */
    Insertion<T> tryInsert(T data, Index parent);
    
    /**
     * Adds a node and designates it as the root of the tree.
     *
     * @param data the payload of the root
     * @return the handle of the root
     * @throws IllegalStateException if the tree already has a root
     */
    Index insertRoot(T data);
    
    /**
     * Like {@link #insertRoot}, but never grows the tree.
     *
     * @param data the payload of the root
     * @return the outcome of the insertion
     * @throws IllegalStateException if the tree already has a root
     */
    Insertion<T> tryInsertRoot(T data);
    
    /**
     * Returns the designated root, if there is one.
     */
    Optional<Index> root();
    
    /**
     * Makes {@code child}, along with its subtree, the last child of {@code parent}. If {@code child} already has a
     * parent, it is moved.
     *
     * @param parent the new parent
     * @param child the node to append
     * @return {@code true} if the nodes were linked, {@code false} (and nothing changed) if either handle is stale
     * @throws IllegalArgumentException if {@code child} is {@code parent}, an ancestor of {@code parent}, or the root
     */
    boolean appendChild(Index parent, Index child);
    
    /**
     * Unlinks a node from its parent and siblings, without removing it or its subtree. Does nothing if the node is
     * already unattached.
     *
     * @param node the node to detach
     * @throws StaleIndexException if {@code node} is stale
     */
    void detach(Index node);
    
    /**
     * Removes a node and its entire subtree. Every handle into the subtree becomes stale.
     *
     * @param node the node to remove
     * @return the payload of the removed node, or empty if {@code node} was already stale
     */
    Optional<T> remove(Index node);
    
    /**
     * Returns the payload of a node, or empty if the handle is stale.
     */
    Optional<T> get(Index node);
    
    /**
     * Replaces the payload of a node with the result of applying {@code updater} to it.
     *
     * @return {@code true} if the node was live and updated
     */
    boolean update(Index node, UnaryOperator<T> updater);
    
    /**
     * Returns the payload of a node that is known to be live.
     *
     * @throws StaleIndexException if {@code node} is stale
     */
    T at(Index node);
    
    /**
     * Replaces the payload of a node that is known to be live.
     *
     * @return the previous payload
     * @throws StaleIndexException if {@code node} is stale
     */
    T set(Index node, T data);
    
    boolean contains(Index node);
    
    /**
     * Returns the parent of a node, or empty if the node is unattached or stale.
     */
    Optional<Index> parent(Index node);
    
    /**
     * Returns the children of a node, in the order they were appended.
     *
     * @throws StaleIndexException if {@code node} is stale
     */
    Iterable<Index> children(Index node);
    
    /**
     * Returns {@code node} followed by its preceding siblings, nearest first.
     *
     * @throws StaleIndexException if {@code node} is stale
     */
    Iterable<Index> precedingSiblings(Index node);
    
    /**
     * Returns {@code node} followed by its following siblings, nearest first.
     *
     * @throws StaleIndexException if {@code node} is stale
     */
    Iterable<Index> followingSiblings(Index node);
    
    /**
     * Returns {@code node} followed by its ancestors, nearest first.
     *
     * @throws StaleIndexException if {@code node} is stale
     */
    Iterable<Index> ancestors(Index node);
    
    /**
     * Returns the start and end edges of a depth-first walk over the subtree rooted at {@code node}.
     *
     * @throws StaleIndexException if {@code node} is stale
     */
    Iterable<NodeEdge> traverse(Index node);
    
    /**
     * Returns {@code node} and its descendants in pre-order: each node before its children, and each child's subtree
     * before that of its next sibling.
     *
     * @throws StaleIndexException if {@code node} is stale
     */
    Iterable<Index> descendants(Index node);
    
    /**
     * Like {@link #descendants}, paired with each node's depth below {@code node}.
     *
     * @throws StaleIndexException if {@code node} is stale
     */
    Iterable<NodeDepth> descendantsWithDepth(Index node);
}

package io.avery.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.function.UnaryOperator;

public class ArenaTree<T> implements Tree<T> {
    /* Nodes are records in a GenerationalArena, linked to each other by Index rather than by reference. Each node
     * carries its parent, its first and last child, and its previous and next sibling, so the children of a node form
     * an intrusive doubly-linked list: append, detach and move are O(1), while counting children requires a walk.
     *
     * The arena only guarantees slot lifetime and handle identity. Keeping the links consistent is entirely up to
     * this class, and every public mutator validates its arguments before touching any link, so that a failed call
     * leaves the tree unchanged.
     */
    
    private static final Logger log = LoggerFactory.getLogger(ArenaTree.class);
    
    static final int DEFAULT_CAPACITY = GenerationalArena.DEFAULT_CAPACITY;
    
    private final GenerationalArena<Node<T>> nodes;
    private Index root;
    
    public ArenaTree() {
        this(DEFAULT_CAPACITY);
    }
    
    public ArenaTree(int initialCapacity) {
        nodes = new GenerationalArena<>(initialCapacity);
    }
    
    private static class Node<T> {
        Index parent;
        Index previousSibling;
        Index nextSibling;
        Index firstChild;
        Index lastChild;
        T data;
        
        Node(T data) {
            this.data = data;
        }
        
        @Override
        public String toString() {
            return "Parent: " + parent
                + ", Previous sibling: " + previousSibling
                + ", Next sibling: " + nextSibling
                + ", First child: " + firstChild
                + ", Last child: " + lastChild;
        }
    }
    
    @Override
    public int capacity() {
        return nodes.capacity();
    }
    
    @Override
    public void reserve(int additional) {
        nodes.reserve(additional);
    }
    
    @Override
    public void clear() {
        nodes.clear();
        root = null;
    }
    
    @Override
    public int size() {
        return nodes.size();
    }
    
    @Override
    public Index insert(T data) {
        return nodes.insert(new Node<>(Objects.requireNonNull(data)));
    }
    
    @Override
    public Index insert(T data, Index parent) {
        Objects.requireNonNull(data);
        Node<T> parentNode = live(parent);
        Index child = nodes.insert(new Node<>(data));
        link(parent, parentNode, child, nodes.get(child));
        return child;
    }
    
    @Override
    public Insertion<T> tryInsert(T data) {
        return tryCreateNode(Objects.requireNonNull(data));
    }
    
    @Override
    public Insertion<T> tryInsert(T data, Index parent) {
        Objects.requireNonNull(data);
        Node<T> parentNode = live(parent);
        Insertion<T> insertion = tryCreateNode(data);
        if (insertion.isInserted()) {
            Index child = insertion.index();
            link(parent, parentNode, child, nodes.get(child));
        }
        return insertion;
    }
    
    @Override
    public Index insertRoot(T data) {
        Objects.requireNonNull(data);
        checkNoRoot();
        return root = nodes.insert(new Node<>(data));
    }
    
    @Override
    public Insertion<T> tryInsertRoot(T data) {
        Objects.requireNonNull(data);
        checkNoRoot();
        Insertion<T> insertion = tryCreateNode(data);
        if (insertion.isInserted()) {
            root = insertion.index();
        }
        return insertion;
    }
    
    @Override
    public Optional<Index> root() {
        return Optional.ofNullable(root);
    }
    
    private void checkNoRoot() {
        if (root != null) {
            throw new IllegalStateException("A root node already exists");
        }
    }
    
    private Insertion<T> tryCreateNode(T data) {
        Insertion<Node<T>> insertion = nodes.tryInsert(new Node<>(data));
        if (!insertion.isInserted()) {
            return Insertion.rejected(insertion.rejectedValue().data);
        }
        return Insertion.inserted(insertion.index());
    }
    
    @Override
    public boolean appendChild(Index parent, Index child) {
        if (parent.equals(child)) {
            if (!nodes.contains(parent)) {
                return false;
            }
            throw new IllegalArgumentException("Cannot append " + child + " to itself");
        }
        if (parent.slot() == child.slot()) {
            // Same slot, different generations: at most one of them is live
            return false;
        }
        GenerationalArena.Pair<Node<T>> pair = nodes.getPair(parent, child);
        Node<T> parentNode = pair.first();
        Node<T> childNode = pair.second();
        if (parentNode == null || childNode == null) {
            return false;
        }
        if (child.equals(root)) {
            throw new IllegalArgumentException("Cannot append the root " + child + " to " + parent);
        }
        for (Index ancestor = parentNode.parent; ancestor != null; ancestor = linked(ancestor).parent) {
            if (ancestor.equals(child)) {
                throw new IllegalArgumentException("Cannot append " + child + " to its own descendant " + parent);
            }
        }
        if (childNode.parent != null) {
            log.trace("Moving {} from {} to {}", child, childNode.parent, parent);
        }
        unlink(childNode);
        link(parent, parentNode, child, childNode);
        return true;
    }
    
    @Override
    public void detach(Index node) {
        unlink(live(node));
    }
    
    @Override
    public Optional<T> remove(Index node) {
        if (!nodes.contains(node)) {
            return Optional.empty();
        }
        
        // Collect the subtree before unlinking anything, since the walk follows the links.
        List<Index> descendants = new ArrayList<>();
        Iterator<Index> walk = new StartEdgeItr<>(node, NodeEdge.Start::index);
        walk.next();
        walk.forEachRemaining(descendants::add);
        
        Node<T> removed = nodes.remove(node);
        relink(removed.parent, removed.previousSibling, removed.nextSibling);
        for (Index descendant : descendants) {
            nodes.remove(descendant);
        }
        if (node.equals(root)) {
            root = null;
        }
        log.trace("Removed {} with {} descendants", node, descendants.size());
        return Optional.of(removed.data);
    }
    
    @Override
    public Optional<T> get(Index node) {
        Node<T> n = nodes.get(node);
        return n == null ? Optional.empty() : Optional.of(n.data);
    }
    
    @Override
    public boolean update(Index node, UnaryOperator<T> updater) {
        Objects.requireNonNull(updater);
        Node<T> n = nodes.get(node);
        if (n == null) {
            return false;
        }
        n.data = Objects.requireNonNull(updater.apply(n.data));
        return true;
    }
    
    @Override
    public T at(Index node) {
        return live(node).data;
    }
    
    @Override
    public T set(Index node, T data) {
        Objects.requireNonNull(data);
        Node<T> n = live(node);
        T old = n.data;
        n.data = data;
        return old;
    }
    
    @Override
    public boolean contains(Index node) {
        return nodes.contains(node);
    }
    
    @Override
    public Optional<Index> parent(Index node) {
        Node<T> n = nodes.get(node);
        return n == null ? Optional.empty() : Optional.ofNullable(n.parent);
    }
    
    @Override
    public Iterable<Index> children(Index node) {
        live(node);
        return () -> {
            Node<T> n = nodes.get(node);
            return new LinkItr(n == null ? null : n.firstChild, next -> next.nextSibling);
        };
    }
    
    @Override
    public Iterable<Index> precedingSiblings(Index node) {
        live(node);
        return () -> new LinkItr(node, n -> n.previousSibling);
    }
    
    @Override
    public Iterable<Index> followingSiblings(Index node) {
        live(node);
        return () -> new LinkItr(node, n -> n.nextSibling);
    }
    
    @Override
    public Iterable<Index> ancestors(Index node) {
        live(node);
        return () -> new LinkItr(node, n -> n.parent);
    }
    
    @Override
    public Iterable<NodeEdge> traverse(Index node) {
        live(node);
        return () -> new TraverseItr(node);
    }
    
    @Override
    public Iterable<Index> descendants(Index node) {
        live(node);
        return () -> new StartEdgeItr<>(node, NodeEdge.Start::index);
    }
    
    @Override
    public Iterable<NodeDepth> descendantsWithDepth(Index node) {
        live(node);
        return () -> new StartEdgeItr<>(node, start -> new NodeDepth(start.index(), start.depth()));
    }
    
    // Appends an unattached child as the last child of parent.
    private void link(Index parent, Node<T> parentNode, Index child, Node<T> childNode) {
        assert childNode.parent == null && childNode.previousSibling == null && childNode.nextSibling == null : childNode;
        childNode.parent = parent;
        Index last = parentNode.lastChild;
        parentNode.lastChild = child;
        if (last != null) {
            Node<T> lastNode = linked(last);
            assert lastNode.nextSibling == null : lastNode;
            childNode.previousSibling = last;
            lastNode.nextSibling = child;
        }
        else {
            assert parentNode.firstChild == null : parentNode;
            parentNode.firstChild = child;
        }
    }
    
    private void unlink(Node<T> node) {
        Index parent = node.parent;
        Index previous = node.previousSibling;
        Index next = node.nextSibling;
        node.parent = null;
        node.previousSibling = null;
        node.nextSibling = null;
        relink(parent, previous, next);
    }
    
    // Closes the gap left in a sibling list by a node with the given parent and neighbors.
    private void relink(Index parent, Index previous, Index next) {
        if (next != null) {
            linked(next).previousSibling = previous;
        }
        else if (parent != null) {
            linked(parent).lastChild = previous;
        }
        if (previous != null) {
            linked(previous).nextSibling = next;
        }
        else if (parent != null) {
            linked(parent).firstChild = next;
        }
    }
    
    // Resolves a handle supplied by the caller.
    private Node<T> live(Index index) {
        Node<T> node = nodes.get(Objects.requireNonNull(index));
        if (node == null) {
            throw new StaleIndexException(index);
        }
        return node;
    }
    
    // Resolves a handle read from a link of a live node, which must itself be live.
    private Node<T> linked(Index index) {
        Node<T> node = nodes.get(index);
        if (node == null) {
            throw new AssertionError("Dangling link to " + index);
        }
        return node;
    }
    
    // Follows one kind of link from node to node. Ends early if it reaches a node that is no longer live.
    private class LinkItr implements Iterator<Index> {
        final Function<Node<T>, Index> step;
        Index next;
        
        LinkItr(Index first, Function<Node<T>, Index> step) {
            this.next = first;
            this.step = step;
        }
        
        @Override
        public boolean hasNext() {
            return next != null && nodes.contains(next);
        }
        
        @Override
        public Index next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Index curr = next;
            next = step.apply(nodes.get(curr));
            return curr;
        }
    }
    
    private class TraverseItr implements Iterator<NodeEdge> {
        final Index root;
        NodeEdge next;
        
        TraverseItr(Index root) {
            this.root = root;
            this.next = new NodeEdge.Start(root, 0);
        }
        
        @Override
        public boolean hasNext() {
            return next != null && nodes.contains(next.index());
        }
        
        @Override
        public NodeEdge next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            NodeEdge item = next;
            next = successor(item);
            return item;
        }
        
        private NodeEdge successor(NodeEdge edge) {
            Index index = edge.index();
            int depth = edge.depth();
            Node<T> node = nodes.get(index);
            if (edge instanceof NodeEdge.Start) {
                return node.firstChild != null
                    ? new NodeEdge.Start(node.firstChild, depth + 1)
                    : new NodeEdge.End(index, depth);
            }
            if (index.equals(root)) {
                return null;
            }
            if (node.nextSibling != null) {
                return new NodeEdge.Start(node.nextSibling, depth);
            }
            // A missing parent here means the tree changed during iteration. Stop rather than fail.
            return node.parent != null ? new NodeEdge.End(node.parent, depth - 1) : null;
        }
    }
    
    // Reports the Start edges of a walk, skipping End edges.
    private class StartEdgeItr<R> implements Iterator<R> {
        final TraverseItr edges;
        final Function<NodeEdge.Start, R> mapper;
        NodeEdge.Start pending;
        
        StartEdgeItr(Index root, Function<NodeEdge.Start, R> mapper) {
            this.edges = new TraverseItr(root);
            this.mapper = mapper;
        }
        
        @Override
        public boolean hasNext() {
            while (pending == null && edges.hasNext()) {
                if (edges.next() instanceof NodeEdge.Start start) {
                    pending = start;
                }
            }
            return pending != null;
        }
        
        @Override
        public R next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            NodeEdge.Start start = pending;
            pending = null;
            return mapper.apply(start);
        }
    }
}

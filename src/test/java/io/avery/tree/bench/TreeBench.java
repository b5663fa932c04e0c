package io.avery.tree.bench;

import io.avery.tree.ArenaTree;
import io.avery.tree.Index;
import io.avery.tree.NodeDepth;
import io.avery.tree.Tree;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 5, time = 5)
@Fork(value = 3)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class TreeBench {
//    @Param({"100", "1000", "10000"})
    @Param({"100", "1000", "10000", "100000", "1000000"})
    public int n;
    
    Tree<Integer> tree;
    Index root;
    
    // Random-shaped tree: each node is appended under a uniformly chosen earlier node.
    @Setup(Level.Iteration)
    public void setupTree() {
        Random random = new Random(42);
        tree = new ArenaTree<>(n);
        List<Index> nodes = new ArrayList<>(n);
        nodes.add(root = tree.insertRoot(0));
        for (int i = 1; i < n; i++) {
            nodes.add(tree.insert(i, nodes.get(random.nextInt(nodes.size()))));
        }
    }
    
    @Benchmark
    @BenchmarkMode(value = Mode.SampleTime)
    public Object benchInsert() {
        Tree<Integer> t = new ArenaTree<>();
        Index r = t.insertRoot(0);
        Index curr = r;
        for (int i = 1; i < n; i++) {
            // Alternate between widening and deepening
            curr = t.insert(i, (i & 1) == 0 ? r : curr);
        }
        return t;
    }
    
    @Benchmark
    @BenchmarkMode(value = Mode.SampleTime)
    public Object benchDescendants() {
        long sum = 0;
        for (Index index : tree.descendants(root)) {
            sum += tree.at(index);
        }
        return sum;
    }
    
    @Benchmark
    @BenchmarkMode(value = Mode.SampleTime)
    public Object benchDescendantsWithDepth() {
        long sum = 0;
        for (NodeDepth node : tree.descendantsWithDepth(root)) {
            sum += node.depth();
        }
        return sum;
    }
    
    @Benchmark
    @BenchmarkMode(value = Mode.SingleShotTime)
    public Object benchRemoveRoot() {
        return tree.remove(root);
    }
}

package io.github.eutro.scriptlift.core.util;

import io.github.eutro.scriptlift.core.cfg.BasicBlock;
import io.github.eutro.scriptlift.core.cfg.ControlFlowGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Iterator;
import java.util.function.Function;

/**
 * Walks a graph depth-first, in pre- or post-order.
 * <p>
 * Each node is visited once, even if the graph has cycles.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the blocks of a control flow graph, starting at its entry.
     *
     * @param cfg The graph, which must not be empty.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(ControlFlowGraph cfg) {
        BasicBlock entry = cfg.getEntry();
        if (entry == null) throw new IllegalArgumentException("cannot walk an empty graph");
        return new GraphWalker<>(entry, block -> {
            List<BasicBlock> succs = new ArrayList<>(block.getSuccessors().size());
            for (int id : block.getSuccessors()) {
                succs.add(cfg.getBlock(id));
            }
            return succs;
        });
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> preOrder() {
        return PreIter::new;
    }

    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Object sentinel = new Object();
        private final Deque<Object> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @SuppressWarnings("unchecked")
        @Override
        public T next() {
            while (true) {
                Object last = stack.getLast();
                if (last == sentinel) {
                    stack.removeLast();
                    return (T) stack.removeLast();
                }
                stack.addLast(sentinel);
                for (T next : getChildren.apply((T) last)) {
                    if (seen.add(next)) {
                        stack.addLast(next);
                    }
                }
            }
        }
    }
}

package io.github.eutro.funcextract.core.util;

import java.util.*;

/**
 * Walks a graph depth-first from a root, visiting each node once.
 * <p>
 * The stack and the visited set belong to a single {@link #walk()}, so nothing carries
 * over from one walk to the next.
 *
 * @param <T> The node type. Nodes are compared with {@code equals} and {@code hashCode}.
 */
public class GraphWalker<T> {
    private final T root;
    private final F<? super T, ? extends Iterable<? extends T>> edges;

    /**
     * Construct a walker.
     *
     * @param root  The node to start from.
     * @param edges The nodes each node leads to.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> edges) {
        this.root = root;
        this.edges = edges;
    }

    /**
     * Walk the graph.
     *
     * @return Every node reachable from the root, the root first, in the order they were visited.
     */
    public List<T> walk() {
        List<T> order = new ArrayList<>();
        Set<T> visited = new HashSet<>();
        Deque<T> stack = new ArrayDeque<>();
        stack.push(root);
        visited.add(root);
        while (!stack.isEmpty()) {
            T node = stack.pop();
            order.add(node);
            for (T next : edges.apply(node)) {
                if (visited.add(next)) stack.push(next);
            }
        }
        return order;
    }
}

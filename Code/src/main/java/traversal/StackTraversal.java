package traversal;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * In-place traversal driven by an explicit heap-allocated stack instead of
 * host recursion.
 *
 * A node is pushed at most twice: once to be opened and once to be emitted.
 * Opening a node pushes its right child, the node itself, then its left child,
 * so the left subtree drains before the node resurfaces and the node is emitted
 * before the right subtree starts. The opened set is keyed on node identity;
 * values may repeat across distinct nodes.
 */
public final class StackTraversal implements Traversal {

    public static final StackTraversal INSTANCE = new StackTraversal();

    @Override
    public <V extends Comparable<? super V>> Iterator<Node<V>> traverse(final Node<V> root) {
        return new InOrder<>(Objects.requireNonNull(root, "root"));
    }

    @Override
    public String name() {
        return "stack";
    }

    private static final class InOrder<V extends Comparable<? super V>> implements Iterator<Node<V>> {
        private final ArrayDeque<Node<V>> stack = new ArrayDeque<>();
        private final Set<Node<V>> opened = Collections.newSetFromMap(new IdentityHashMap<>());
        private Node<V> pending;

        InOrder(final Node<V> root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            if (pending == null) pending = advance();
            return pending != null;
        }

        @Override
        public Node<V> next() {
            if (!hasNext()) throw new NoSuchElementException();
            Node<V> n = pending;
            pending = null;
            return n;
        }

        private Node<V> advance() {
            while (!stack.isEmpty()) {
                Node<V> n = stack.pop();
                if (opened.contains(n)) {
                    opened.remove(n);
                    return n;
                }
                opened.add(n);
                if (n.right != null) stack.push(n.right);
                stack.push(n);
                if (n.left != null) stack.push(n.left);
            }
            return null;
        }
    }
}

package traversal;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Reference in-place traversal. Each node gets its own iterator which defers
 * to a child iterator for its left and right subtrees. Every iterator caches
 * whether it is positioned on its next element, so a repeated hasNext() is
 * O(1) and next() hands straight down the chain: one element costs O(depth),
 * a full walk O(n * h) in the worst case, and the host stack grows O(h).
 * Trees deeper than the thread's stack allows end in
 * {@link StackOverflowError}; use {@link StackTraversal} for those.
 */
public final class RecursiveTraversal implements Traversal {

    public static final RecursiveTraversal INSTANCE = new RecursiveTraversal();

    @Override
    public <V extends Comparable<? super V>> Iterator<Node<V>> traverse(final Node<V> root) {
        return new InOrder<>(Objects.requireNonNull(root, "root"));
    }

    @Override
    public String name() {
        return "recursive";
    }

    private static final class InOrder<V extends Comparable<? super V>> implements Iterator<Node<V>> {
        private static final int START = 0, LEFT = 1, SELF = 2, RIGHT = 3, DONE = 4;

        private final Node<V> node;
        private int phase = START;
        private Iterator<Node<V>> child;
        private boolean positioned;

        InOrder(final Node<V> node) {
            this.node = node;
        }

        @Override
        public boolean hasNext() {
            if (positioned) return phase != DONE;
            positioned = true;
            while (true) {
                switch (phase) {
                    case START:
                        child = (node.left != null) ? new InOrder<>(node.left) : null;
                        phase = LEFT;
                        break;
                    case LEFT:
                        if (child != null && child.hasNext()) return true;
                        child = null;
                        phase = SELF;
                        break;
                    case SELF:
                        return true;
                    case RIGHT:
                        if (child != null && child.hasNext()) return true;
                        child = null;
                        phase = DONE;
                        break;
                    default:
                        return false;
                }
            }
        }

        @Override
        public Node<V> next() {
            if (!hasNext()) throw new NoSuchElementException();
            positioned = false;
            if (phase == SELF) {
                phase = RIGHT;
                child = (node.right != null) ? new InOrder<>(node.right) : null;
                return node;
            }
            return child.next();
        }
    }
}

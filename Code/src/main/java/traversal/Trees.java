package traversal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Structural helpers over {@link Node} trees. Every walk here uses an explicit
 * stack, so trees of any height are handled without host recursion.
 */
public final class Trees {

    private Trees() {
    }

    /**
     * size(node) = 1 + size(left) + size(right), with an absent node counting 0.
     */
    public static <V extends Comparable<? super V>> int size(final Node<V> node) {
        if (node == null) return 0;
        int count = 0;
        ArrayDeque<Node<V>> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            Node<V> n = stack.pop();
            count++;
            if (n.left != null) stack.push(n.left);
            if (n.right != null) stack.push(n.right);
        }
        return count;
    }

    /** Every node of the tree in pre-order, found by structure alone. */
    public static <V extends Comparable<? super V>> List<Node<V>> preOrder(final Node<V> node) {
        List<Node<V>> out = new ArrayList<>();
        if (node == null) return out;
        ArrayDeque<Node<V>> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            Node<V> n = stack.pop();
            out.add(n);
            if (n.right != null) stack.push(n.right);
            if (n.left != null) stack.push(n.left);
        }
        return out;
    }

    /** Number of levels; 0 for an absent tree, 1 for a single node. */
    public static <V extends Comparable<? super V>> int height(final Node<V> node) {
        if (node == null) return 0;
        int max = 0;
        ArrayDeque<Node<V>> nodes = new ArrayDeque<>();
        ArrayDeque<Integer> depths = new ArrayDeque<>();
        nodes.push(node);
        depths.push(1);
        while (!nodes.isEmpty()) {
            Node<V> n = nodes.pop();
            int d = depths.pop();
            if (d > max) max = d;
            if (n.left != null)  { nodes.push(n.left);  depths.push(d + 1); }
            if (n.right != null) { nodes.push(n.right); depths.push(d + 1); }
        }
        return max;
    }

    /**
     * Renders a tree as nested constructor calls, e.g. {@code node(1, node(2), null)}.
     * Leaves render without children.
     */
    public static <V extends Comparable<? super V>> String render(final Node<V> node) {
        if (node == null) return "null";
        StringBuilder sb = new StringBuilder();
        ArrayDeque<Piece<V>> work = new ArrayDeque<>();
        work.push(Piece.of(node));
        while (!work.isEmpty()) {
            Piece<V> top = work.pop();
            if (top.node == null) {
                sb.append(top.text);
                continue;
            }
            Node<V> n = top.node;
            if (n.isLeaf()) {
                sb.append("node(").append(n.value).append(')');
                continue;
            }
            work.push(Piece.text(")"));
            work.push(Piece.of(n.right));
            work.push(Piece.text(", "));
            work.push(Piece.of(n.left));
            sb.append("node(").append(n.value).append(", ");
        }
        return sb.toString();
    }

    /** Pending output for {@link #render}: a node to expand or literal text. */
    private static final class Piece<V extends Comparable<? super V>> {
        final Node<V> node;
        final String text;

        private Piece(final Node<V> node, final String text) {
            this.node = node;
            this.text = text;
        }

        static <V extends Comparable<? super V>> Piece<V> of(final Node<V> node) {
            return (node != null) ? new Piece<>(node, null) : new Piece<>(null, "null");
        }

        static <V extends Comparable<? super V>> Piece<V> text(final String text) {
            return new Piece<>(null, text);
        }
    }

    /** Deep copy; the copy shares no node with the original. */
    public static <V extends Comparable<? super V>> Node<V> copy(final Node<V> node) {
        return copyReplacing(node, null, null);
    }

    /**
     * Deep copy of {@code root} in which the subtree at {@code target} (matched
     * by identity) is swapped for a copy of {@code replacement}, which may be null.
     * Built bottom-up from an explicit stack.
     */
    static <V extends Comparable<? super V>> Node<V> copyReplacing(final Node<V> root, final Node<V> target,
                                                                   final Node<V> replacement) {
        // finished copies; may hold nulls for absent children
        List<Node<V>> built = new ArrayList<>();
        ArrayDeque<Frame<V>> work = new ArrayDeque<>();
        work.push(new Frame<>(resolve(root, target, replacement)));
        while (!work.isEmpty()) {
            Frame<V> f = work.pop();
            if (f.src == null) {
                built.add(null);
            } else if (!f.expanded) {
                f.expanded = true;
                work.push(f);
                work.push(new Frame<>(resolve(f.src.right, target, replacement)));
                work.push(new Frame<>(resolve(f.src.left, target, replacement)));
            } else {
                Node<V> r = built.remove(built.size() - 1);
                Node<V> l = built.remove(built.size() - 1);
                built.add(Node.of(f.src.value, l, r));
            }
        }
        return built.get(0);
    }

    private static <V extends Comparable<? super V>> Node<V> resolve(final Node<V> n, final Node<V> target,
                                                                     final Node<V> replacement) {
        return (n != null && n == target) ? replacement : n;
    }

    private static final class Frame<V extends Comparable<? super V>> {
        final Node<V> src;
        boolean expanded;

        Frame(final Node<V> src) {
            this.src = src;
        }
    }

    /**
     * Trees obtained from {@code root} by removing exactly one piece of
     * substructure: dropping a non-root subtree, or replacing a node with one of
     * its children. Every candidate is strictly smaller than {@code root} and
     * keeps a subset of its values. Targets are visited in pre-order, so larger
     * cuts come first. Each candidate is built only when the iterator reaches it.
     */
    public static <V extends Comparable<? super V>> Iterator<Node<V>> subtreeCandidates(final Node<V> root) {
        return new Candidates<>(root);
    }

    private static final class Candidates<V extends Comparable<? super V>> implements Iterator<Node<V>> {
        private static final int REMOVE = 0, LEFT = 1, RIGHT = 2;

        private final Node<V> root;
        private final List<Node<V>> targets;
        private int target;
        private int kind = REMOVE;
        private Node<V> pending;

        Candidates(final Node<V> root) {
            this.root = Objects.requireNonNull(root, "root");
            this.targets = preOrder(root);
        }

        @Override
        public boolean hasNext() {
            while (pending == null && target < targets.size()) {
                Node<V> t = targets.get(target);
                int k = kind;
                if (++kind > RIGHT) {
                    kind = REMOVE;
                    target++;
                }
                if (k == REMOVE && t != root) pending = copyReplacing(root, t, null);
                else if (k == LEFT && t.left != null) pending = copyReplacing(root, t, t.left);
                else if (k == RIGHT && t.right != null) pending = copyReplacing(root, t, t.right);
            }
            return pending != null;
        }

        @Override
        public Node<V> next() {
            if (!hasNext()) throw new NoSuchElementException();
            Node<V> n = pending;
            pending = null;
            return n;
        }
    }
}

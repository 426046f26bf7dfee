package traversal;

import java.util.List;
import java.util.Optional;

/**
 * A subtree root S with at most one node drawn from each of its sides.
 *
 * Drawing a random subtree root and then one descendant per side covers the
 * same pairs as drawing two arbitrary nodes and taking their least common
 * ancestor, without computing the ancestor.
 */
public final class OrderingSample<V extends Comparable<? super V>> {
    final Node<V> subtree;
    final Node<V> fromLeft;   // null when S has no left child
    final Node<V> fromRight;  // null when S has no right child

    private OrderingSample(final Node<V> subtree, final Node<V> fromLeft, final Node<V> fromRight) {
        this.subtree = subtree;
        this.fromLeft = fromLeft;
        this.fromRight = fromRight;
    }

    static <V extends Comparable<? super V>> OrderingSample<V> of(final Node<V> subtree, final Node<V> fromLeft,
                                                                  final Node<V> fromRight) {
        return new OrderingSample<>(subtree, fromLeft, fromRight);
    }

    /**
     * Picks S as the {@code subtreeDraw}-th node (modulo size) of the walk over
     * {@code root}, then one node from each present side the same way. Empty
     * when S roots a subtree of size 1; the caller should reject and redraw.
     */
    public static <V extends Comparable<? super V>> Optional<OrderingSample<V>> draw(
            final Traversal traversal, final Node<V> root,
            final int subtreeDraw, final int leftDraw, final int rightDraw) {
        Node<V> s = pick(traversal, root, subtreeDraw);
        if (s.isLeaf()) return Optional.empty();
        Node<V> l = (s.left != null) ? pick(traversal, s.left, leftDraw) : null;
        Node<V> r = (s.right != null) ? pick(traversal, s.right, rightDraw) : null;
        return Optional.of(new OrderingSample<>(s, l, r));
    }

    private static <V extends Comparable<? super V>> Node<V> pick(final Traversal traversal, final Node<V> root, final int draw) {
        List<Node<V>> nodes = traversal.toList(root);
        if (nodes.isEmpty()) {
            throw new PropertyViolation(PropertyViolation.Property.COMPLETENESS, traversal.name(),
                    "emitted nothing for a non-empty subtree", Trees.render(root));
        }
        return nodes.get(Math.floorMod(draw, nodes.size()));
    }

    public Node<V> subtree() {
        return subtree;
    }

    public Node<V> fromLeft() {
        return fromLeft;
    }

    public Node<V> fromRight() {
        return fromRight;
    }

    @Override
    public String toString() {
        return "S=" + subtree.value
                + " L=" + (fromLeft != null ? fromLeft.value : "-")
                + " R=" + (fromRight != null ? fromRight.value : "-");
    }
}

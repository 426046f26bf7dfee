package traversal;

import java.util.Objects;

/**
 * Immutable binary tree node. A node exclusively owns its children and keeps
 * no parent link. Equality is identity: two nodes holding the same value are
 * still different nodes.
 */
public final class Node<V extends Comparable<? super V>> {
    final V value;
    final Node<V> left;   // null when absent
    final Node<V> right;  // null when absent

    private Node(final V value, final Node<V> left, final Node<V> right) {
        this.value = Objects.requireNonNull(value, "value");
        this.left = left;
        this.right = right;
    }

    //--------------------------------------------------------------------------------
    // FACTORIES
    //--------------------------------------------------------------------------------

    public static <V extends Comparable<? super V>> Node<V> of(V value, Node<V> left, Node<V> right) {
        return new Node<>(value, left, right);
    }

    public static <V extends Comparable<? super V>> Node<V> leaf(V value) {
        return new Node<>(value, null, null);
    }

    public static <V extends Comparable<? super V>> Node<V> left(V value, Node<V> left) {
        return new Node<>(value, left, null);
    }

    public static <V extends Comparable<? super V>> Node<V> right(V value, Node<V> right) {
        return new Node<>(value, null, right);
    }

    //--------------------------------------------------------------------------------
    // ACCESSORS
    //--------------------------------------------------------------------------------

    public V value() {
        return value;
    }

    /** @return the left child, or null when absent */
    public Node<V> left() {
        return left;
    }

    /** @return the right child, or null when absent */
    public Node<V> right() {
        return right;
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    /** Number of nodes in the subtree rooted here. O(n). */
    public int size() {
        return Trees.size(this);
    }

    @Override
    public String toString() {
        return Trees.render(this);
    }
}

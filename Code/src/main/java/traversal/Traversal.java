package traversal;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * In-place (in-order) traversal: every node of the left subtree, then the
 * node, then every node of the right subtree.
 */
public interface Traversal {

    /**
     * Lazily walks the tree rooted at {@code root}. The returned iterator is
     * single use; call again to walk the tree a second time.
     *
     * PRECONDITION: root is non-null, acyclic and finite.
     */
    <V extends Comparable<? super V>> Iterator<Node<V>> traverse(Node<V> root);

    String name();

    default <V extends Comparable<? super V>> List<Node<V>> toList(final Node<V> root) {
        List<Node<V>> out = new ArrayList<>();
        traverse(root).forEachRemaining(out::add);
        return out;
    }

    default <V extends Comparable<? super V>> List<V> values(final Node<V> root) {
        List<V> out = new ArrayList<>();
        traverse(root).forEachRemaining(n -> out.add(n.value));
        return out;
    }
}

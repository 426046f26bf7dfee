package traversal;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static traversal.PropertyViolation.Property.COMPLETENESS;
import static traversal.PropertyViolation.Property.EQUIVALENCE;
import static traversal.PropertyViolation.Property.ORDERING;

/**
 * Checks a traversal against three properties. Each check is a pure function
 * of its inputs and throws {@link PropertyViolation} on failure. Removing
 * structure from a failing tree never makes a check harder to fail for the
 * same defect, so the failing tree can be shrunk.
 */
public final class TraversalOracle {

    static final Logger LOGGER = Logger.getLogger(TraversalOracle.class.getName());

    private TraversalOracle() {
    }

    /**
     * count(traverse(T)) == count(distinct values) == size(T). Relies on the
     * tree carrying unique values, so a repeated emission shows up as a value
     * count mismatch.
     */
    public static <V extends Comparable<? super V>> void checkCompleteness(final Traversal traversal, final Node<V> root) {
        List<V> values = traversal.values(root);
        Set<V> distinct = new HashSet<>(values);
        int size = Trees.size(root);
        LOGGER.fine(() -> traversal.name() + " completeness: emitted=" + values.size()
                + " distinct=" + distinct.size() + " size=" + size);
        if (values.size() != distinct.size() || values.size() != size) {
            throw new PropertyViolation(COMPLETENESS, traversal.name(),
                    "emitted " + values.size() + " nodes, " + distinct.size() + " distinct values, size is " + size
                            + ", order " + values,
                    Trees.render(root));
        }
    }

    /**
     * index(L) < index(S) < index(R) within the full traversal of {@code root};
     * only the sides present in the sample are checked.
     */
    public static <V extends Comparable<? super V>> void checkOrdering(final Traversal traversal, final Node<V> root,
                                                                      final OrderingSample<V> sample) {
        checkOrdering(traversal, root, indexByIdentity(traversal.toList(root)), sample);
    }

    private static <V extends Comparable<? super V>> void checkOrdering(final Traversal traversal, final Node<V> root,
                                                                       final Map<Node<V>, Integer> index,
                                                                       final OrderingSample<V> sample) {
        int s = indexOf(index, sample.subtree, traversal, root, sample);
        LOGGER.fine(() -> traversal.name() + " ordering: " + sample + " index(S)=" + s);
        if (sample.fromLeft != null) {
            int l = indexOf(index, sample.fromLeft, traversal, root, sample);
            if (l >= s) {
                throw new PropertyViolation(ORDERING, traversal.name(),
                        "left node " + sample.fromLeft.value + " at index " + l
                                + " does not precede subtree root " + sample.subtree.value + " at index " + s,
                        Trees.render(root));
            }
        }
        if (sample.fromRight != null) {
            int r = indexOf(index, sample.fromRight, traversal, root, sample);
            if (s >= r) {
                throw new PropertyViolation(ORDERING, traversal.name(),
                        "subtree root " + sample.subtree.value + " at index " + s
                                + " does not precede right node " + sample.fromRight.value + " at index " + r,
                        Trees.render(root));
            }
        }
    }

    /**
     * Ordering over every subtree root and every node on either side of it,
     * with the sides found by structure rather than by the traversal under
     * test. Quadratic; meant for small trees such as shrink candidates.
     */
    public static <V extends Comparable<? super V>> void checkOrderingExhaustive(final Traversal traversal, final Node<V> root) {
        Map<Node<V>, Integer> index = indexByIdentity(traversal.toList(root));
        for (Node<V> s : Trees.preOrder(root)) {
            if (s.isLeaf()) continue;
            for (Node<V> l : Trees.preOrder(s.left)) {
                checkOrdering(traversal, root, index, OrderingSample.of(s, l, null));
            }
            for (Node<V> r : Trees.preOrder(s.right)) {
                checkOrdering(traversal, root, index, OrderingSample.of(s, null, r));
            }
        }
    }

    /** Both traversals emit the same nodes, by identity, in the same order. */
    public static <V extends Comparable<? super V>> void checkEquivalence(final Traversal reference, final Traversal candidate,
                                                                         final Node<V> root) {
        List<Node<V>> expected = reference.toList(root);
        List<Node<V>> actual = candidate.toList(root);
        int n = Math.min(expected.size(), actual.size());
        for (int i = 0; i < n; i++) {
            if (expected.get(i) != actual.get(i)) {
                throw new PropertyViolation(EQUIVALENCE, candidate.name(),
                        "position " + i + ": " + reference.name() + " emitted " + expected.get(i).value
                                + ", " + candidate.name() + " emitted " + actual.get(i).value,
                        Trees.render(root));
            }
        }
        if (expected.size() != actual.size()) {
            throw new PropertyViolation(EQUIVALENCE, candidate.name(),
                    reference.name() + " emitted " + expected.size() + " nodes, "
                            + candidate.name() + " emitted " + actual.size(),
                    Trees.render(root));
        }
    }

    static <V extends Comparable<? super V>> Map<Node<V>, Integer> indexByIdentity(final List<Node<V>> order) {
        Map<Node<V>, Integer> index = new IdentityHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            index.putIfAbsent(order.get(i), i);
        }
        return index;
    }

    private static <V extends Comparable<? super V>> int indexOf(final Map<Node<V>, Integer> index, final Node<V> node,
                                                                final Traversal traversal, final Node<V> root,
                                                                final OrderingSample<V> sample) {
        Integer i = index.get(node);
        if (i == null) {
            throw new PropertyViolation(ORDERING, traversal.name(),
                    "node " + node.value + " missing from traversal (" + sample + ")", Trees.render(root));
        }
        return i;
    }
}

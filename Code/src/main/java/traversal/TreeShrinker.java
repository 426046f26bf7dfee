package traversal;

import java.util.Iterator;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Greedy minimisation of a failing tree. Each round tries the candidates from
 * {@link Trees#subtreeCandidates} and keeps the first one that still fails;
 * it stops when no candidate fails. The result fails, and no single removal
 * from it does.
 */
public final class TreeShrinker {

    private static final Logger LOGGER = Logger.getLogger(TreeShrinker.class.getName());

    private TreeShrinker() {
    }

    public static <V extends Comparable<? super V>> Node<V> shrink(final Node<V> failing, final Predicate<Node<V>> stillFails) {
        if (!stillFails.test(failing)) {
            throw new IllegalArgumentException("tree does not fail: " + Trees.render(failing));
        }
        Node<V> current = failing;
        int steps = 0;
        boolean progress = true;
        while (progress) {
            progress = false;
            Iterator<Node<V>> candidates = Trees.subtreeCandidates(current);
            while (candidates.hasNext()) {
                Node<V> candidate = candidates.next();
                if (stillFails.test(candidate)) {
                    current = candidate;
                    steps++;
                    progress = true;
                    break;
                }
            }
        }
        final int taken = steps;
        final int from = Trees.size(failing);
        final int to = Trees.size(current);
        LOGGER.fine(() -> "shrunk " + from + " -> " + to + " nodes in " + taken + " steps");
        return current;
    }

    /** Adapts a check that throws {@link PropertyViolation} into a shrink predicate. */
    public static <V extends Comparable<? super V>> Predicate<Node<V>> violates(final Consumer<Node<V>> check) {
        return tree -> {
            try {
                check.accept(tree);
                return false;
            } catch (PropertyViolation expected) {
                return true;
            }
        };
    }
}

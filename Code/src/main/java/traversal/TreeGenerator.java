package traversal;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Produces arbitrary finite trees whose values are unique within each tree,
 * so the number of distinct values always equals the number of nodes.
 */
public final class TreeGenerator {

    public enum Side { LEFT, RIGHT }

    private static final double ABSENT_CHILD = 0.3;

    private TreeGenerator() {
    }

    //--------------------------------------------------------------------------------
    // jqwik strategy
    //--------------------------------------------------------------------------------

    /**
     * Recursive strategy: the base rule is a single leaf, the recursive rule
     * builds a node whose two children are each either absent or a smaller
     * tree. Expansion stops at {@code maxDepth} levels of recursion. Values are
     * numbered 0..n-1 in pre-order once the shape is fixed, so shrinking works
     * on shape alone.
     */
    public static Arbitrary<Node<Integer>> trees(final int maxDepth) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        Arbitrary<Shape> shapes = Arbitraries.recursive(
                () -> Arbitraries.just(Shape.LEAF),
                smaller -> Combinators.combine(smaller.injectNull(ABSENT_CHILD), smaller.injectNull(ABSENT_CHILD))
                        .as(Shape::new),
                0, maxDepth);
        return shapes.map(s -> s.materialize(new int[1]));
    }

    /** Template without values; materialised into fresh nodes. */
    private static final class Shape {
        static final Shape LEAF = new Shape(null, null);

        final Shape left;
        final Shape right;

        Shape(final Shape left, final Shape right) {
            this.left = left;
            this.right = right;
        }

        Node<Integer> materialize(final int[] next) {
            int value = next[0]++;
            Node<Integer> l = (left != null) ? left.materialize(next) : null;
            Node<Integer> r = (right != null) ? right.materialize(next) : null;
            return Node.of(value, l, r);
        }
    }

    //--------------------------------------------------------------------------------
    // Seeded generation (no jqwik)
    //--------------------------------------------------------------------------------

    /**
     * Grows a random tree of 1..maxNodes nodes by repeatedly filling a randomly
     * chosen empty child slot. Nodes live in index arrays until the shape is
     * complete, then are frozen bottom-up. Values are a random permutation of
     * 0..n-1.
     */
    public static Node<Integer> random(final Random rnd, final int maxNodes) {
        if (maxNodes < 1) throw new IllegalArgumentException("maxNodes must be >= 1: " + maxNodes);
        final int n = 1 + rnd.nextInt(maxNodes);
        final int[] left = new int[n];
        final int[] right = new int[n];
        Arrays.fill(left, -1);
        Arrays.fill(right, -1);

        // slot = parent * 2 + side
        int[] slots = new int[n + 1];
        int open = 0;
        slots[open++] = 0;
        slots[open++] = 1;
        for (int i = 1; i < n; i++) {
            int pick = rnd.nextInt(open);
            int slot = slots[pick];
            slots[pick] = slots[--open];
            if ((slot & 1) == 0) left[slot >> 1] = i;
            else right[slot >> 1] = i;
            slots[open++] = i * 2;
            slots[open++] = i * 2 + 1;
        }

        int[] values = new int[n];
        for (int i = 0; i < n; i++) values[i] = i;
        for (int i = n - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int t = values[i]; values[i] = values[j]; values[j] = t;
        }

        // children always have a larger index than their parent
        List<Node<Integer>> built = new ArrayList<>(Collections.nCopies(n, (Node<Integer>) null));
        for (int i = n - 1; i >= 0; i--) {
            Node<Integer> l = (left[i] >= 0) ? built.get(left[i]) : null;
            Node<Integer> r = (right[i] >= 0) ? built.get(right[i]) : null;
            built.set(i, Node.of(values[i], l, r));
        }
        return built.get(0);
    }

    /**
     * A chain of {@code height} nodes where every node has a single child on
     * the given side. Values count up from the root.
     */
    public static Node<Integer> spine(final int height, final Side side) {
        if (height < 1) throw new IllegalArgumentException("height must be >= 1: " + height);
        Node<Integer> n = null;
        for (int v = height - 1; v >= 0; v--) {
            n = (n == null) ? Node.leaf(v)
                    : (side == Side.LEFT) ? Node.left(v, n) : Node.right(v, n);
        }
        return n;
    }
}

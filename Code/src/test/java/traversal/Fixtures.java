package traversal;

import static traversal.Node.leaf;
import static traversal.Node.of;

/** Hand-built trees shared by the example-based tests. */
final class Fixtures {

    private Fixtures() {
    }

    /**
     * <pre>
     *         1
     *        / \
     *       2   5
     *      / \
     *     3   4
     *        /
     *       6
     * </pre>
     */
    static Node<Integer> blogTree() {
        return of(1, of(2, leaf(3), Node.left(4, leaf(6))), leaf(5));
    }
}

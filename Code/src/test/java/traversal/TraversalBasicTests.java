package traversal;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

public class TraversalBasicTests {

    private static final List<Traversal> ALL = List.of(RecursiveTraversal.INSTANCE, StackTraversal.INSTANCE);

    @Test
    void testLiteralTreeOrder() {
        for (Traversal t : ALL) {
            assertEquals(List.of(3, 2, 6, 4, 1, 5), t.values(Fixtures.blogTree()), t.name());
        }
    }

    @Test
    void testSingleNodeYieldsItself() {
        Node<Integer> n = Node.leaf(42);
        for (Traversal t : ALL) {
            List<Node<Integer>> out = t.toList(n);
            assertEquals(1, out.size(), t.name());
            assertSame(n, out.get(0), t.name());
        }
    }

    @Test
    void testOneSidedNodes() {
        Node<Integer> leftOnly = Node.left(2, Node.leaf(1));
        Node<Integer> rightOnly = Node.right(1, Node.leaf(2));
        for (Traversal t : ALL) {
            assertEquals(List.of(1, 2), t.values(leftOnly), t.name());
            assertEquals(List.of(1, 2), t.values(rightOnly), t.name());
        }
    }

    @Test
    void testEmitsTheTreesOwnNodes() {
        Node<Integer> tree = Fixtures.blogTree();
        for (Traversal t : ALL) {
            List<Node<Integer>> out = t.toList(tree);
            assertSame(tree, out.get(4), t.name());
            assertSame(tree.left(), out.get(1), t.name());
            assertSame(tree.right(), out.get(5), t.name());
        }
    }

    @Test
    void testIteratorIsNotRestartable() {
        Node<Integer> tree = Fixtures.blogTree();
        for (Traversal t : ALL) {
            Iterator<Node<Integer>> it = t.traverse(tree);
            int count = 0;
            while (it.hasNext()) { it.next(); count++; }
            assertEquals(6, count, t.name());
            assertFalse(it.hasNext(), t.name());
            assertThrows(NoSuchElementException.class, it::next, t.name());

            // a fresh call walks the tree again
            assertEquals(6, t.toList(tree).size(), t.name());
        }
    }

    @Test
    void testHasNextIsIdempotent() {
        for (Traversal t : ALL) {
            Iterator<Node<Integer>> it = t.traverse(Fixtures.blogTree());
            assertTrue(it.hasNext());
            assertTrue(it.hasNext());
            assertEquals(3, it.next().value(), t.name());
            assertTrue(it.hasNext());
            assertEquals(2, it.next().value(), t.name());
        }
    }

    @Test
    void testLazyFirstElement() {
        // left spine: the first element is the deepest node
        Node<Integer> spine = TreeGenerator.spine(500, TreeGenerator.Side.LEFT);
        for (Traversal t : ALL) {
            assertEquals(499, t.traverse(spine).next().value(), t.name());
        }
    }

    @Test
    void testNullRootRejected() {
        for (Traversal t : ALL) {
            assertThrows(NullPointerException.class, () -> t.traverse((Node<Integer>) null), t.name());
        }
    }
}

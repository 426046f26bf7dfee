package traversal;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

/**
 * Trees whose nodes share values. Identity-keyed bookkeeping must still visit
 * every node; value-keyed bookkeeping conflates the nodes and drops some.
 */
public class DuplicateValuesTest {

    // node(1, node(1, node(2), null), null): the inner 1 shares its value with the root
    private static Node<Integer> sharedValueChain() {
        return Node.left(1, Node.left(1, Node.leaf(2)));
    }

    @Test
    void testStackTraversalUsesIdentity() {
        Node<Integer> tree = sharedValueChain();
        List<Node<Integer>> out = StackTraversal.INSTANCE.toList(tree);
        assertEquals(3, out.size());
        assertSame(tree.left().left(), out.get(0));
        assertSame(tree.left(), out.get(1));
        assertSame(tree, out.get(2));
        TraversalOracle.checkEquivalence(RecursiveTraversal.INSTANCE, StackTraversal.INSTANCE, tree);
    }

    @Test
    void testAllEqualValues() {
        Node<String> tree = Node.of("x", Node.of("x", Node.leaf("x"), Node.leaf("x")), Node.right("x", Node.leaf("x")));
        assertEquals(6, StackTraversal.INSTANCE.toList(tree).size());
        TraversalOracle.checkEquivalence(RecursiveTraversal.INSTANCE, StackTraversal.INSTANCE, tree);
    }

    @Test
    void testValueKeyedOpenedSetLosesNodes() {
        Node<Integer> tree = sharedValueChain();
        Traversal broken = new ValueKeyedStackTraversal();

        // the inner 1 looks already opened and is emitted before its child
        assertEquals(List.of(1, 1), broken.values(tree));

        PropertyViolation v = assertThrows(PropertyViolation.class,
                () -> TraversalOracle.checkEquivalence(RecursiveTraversal.INSTANCE, broken, tree));
        assertEquals(PropertyViolation.Property.EQUIVALENCE, v.property());
    }

    @Test
    void testValueKeyedIsFineWithUniqueValues() {
        assertEquals(List.of(3, 2, 6, 4, 1, 5), new ValueKeyedStackTraversal().values(Fixtures.blogTree()));
    }

    @Test
    void testCompletenessCheckNeedsUniqueValues() {
        // with repeated values the distinct count no longer matches the size
        PropertyViolation v = assertThrows(PropertyViolation.class,
                () -> TraversalOracle.checkCompleteness(StackTraversal.INSTANCE, sharedValueChain()));
        assertEquals(PropertyViolation.Property.COMPLETENESS, v.property());
    }
}

package traversal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/** Deliberately wrong traversals the oracle has to catch. */
final class BrokenTraversals {

    private BrokenTraversals() {
    }

    /** Node before its subtrees. Complete, but in the wrong order. */
    static final Traversal PRE_ORDER = new Traversal() {
        @Override
        public <V extends Comparable<? super V>> Iterator<Node<V>> traverse(Node<V> root) {
            return Trees.preOrder(root).iterator();
        }

        @Override
        public String name() {
            return "pre-order";
        }
    };

    /** Correct order, but the root is emitted twice. */
    static final Traversal ROOT_TWICE = new Traversal() {
        @Override
        public <V extends Comparable<? super V>> Iterator<Node<V>> traverse(Node<V> root) {
            List<Node<V>> out = StackTraversal.INSTANCE.toList(root);
            out.add(root);
            return out.iterator();
        }

        @Override
        public String name() {
            return "root-twice";
        }
    };

    /** Correct order, but every right subtree is skipped. */
    static final Traversal NO_RIGHT = new Traversal() {
        @Override
        public <V extends Comparable<? super V>> Iterator<Node<V>> traverse(Node<V> root) {
            List<Node<V>> out = new ArrayList<>();
            Node<V> n = root;
            List<Node<V>> path = new ArrayList<>();
            while (n != null) {
                path.add(n);
                n = n.left;
            }
            for (int i = path.size() - 1; i >= 0; i--) out.add(path.get(i));
            return out.iterator();
        }

        @Override
        public String name() {
            return "no-right";
        }
    };

    /** Mirror image: right subtree, node, left subtree. */
    static final Traversal REVERSED = new Traversal() {
        @Override
        public <V extends Comparable<? super V>> Iterator<Node<V>> traverse(Node<V> root) {
            List<Node<V>> out = StackTraversal.INSTANCE.toList(root);
            Collections.reverse(out);
            return out.iterator();
        }

        @Override
        public String name() {
            return "reversed";
        }
    };
}

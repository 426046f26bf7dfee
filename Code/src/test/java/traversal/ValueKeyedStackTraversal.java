package traversal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Stack traversal whose opened set is keyed on node values instead of node
 * identity. Only correct while values are unique; kept to show what goes
 * wrong when they are not.
 */
final class ValueKeyedStackTraversal implements Traversal {

    @Override
    public <V extends Comparable<? super V>> Iterator<Node<V>> traverse(final Node<V> root) {
        ArrayDeque<Node<V>> stack = new ArrayDeque<>();
        Set<V> opened = new HashSet<>();
        List<Node<V>> out = new ArrayList<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node<V> n = stack.pop();
            if (opened.contains(n.value)) {
                out.add(n);
                continue;
            }
            opened.add(n.value);
            if (n.right != null) stack.push(n.right);
            stack.push(n);
            if (n.left != null) stack.push(n.left);
        }
        return out.iterator();
    }

    @Override
    public String name() {
        return "value-keyed";
    }
}

package traversal;

/**
 * A traversal broke one of the oracle's properties. The message always carries
 * the offending tree so the failure can be reproduced by hand.
 */
public class PropertyViolation extends AssertionError {

    public enum Property { COMPLETENESS, ORDERING, EQUIVALENCE }

    private final Property property;
    private final String tree;

    public PropertyViolation(final Property property, final String traversal, final String detail, final String tree) {
        super(property + " violated by " + traversal + " traversal: " + detail + "\n  tree: " + tree);
        this.property = property;
        this.tree = tree;
    }

    public Property property() {
        return property;
    }

    /** Rendered form of the tree the check ran on. */
    public String tree() {
        return tree;
    }
}

package traversal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.logging.Logger;

import traversal.PropertyViolation.Property;

/**
 * Runs the oracle over many seeded random trees on a fixed worker pool. Cases
 * are independent; for each property only the failing case with the lowest
 * index is kept, so the report does not depend on scheduling. Kept failures
 * are shrunk once all cases are done.
 */
public final class OracleRunner {

    static final Logger LOGGER = Logger.getLogger(OracleRunner.class.getName());

    /** Ordering draws per case before a tree counts as having no eligible subtree. */
    private static final int ORDERING_DRAWS = 16;

    public static final class Settings {
        final int cases;
        final int workers;
        final long seed;
        final int maxNodes;

        public Settings(final int cases, final int workers, final long seed, final int maxNodes) {
            if (cases < 1) throw new IllegalArgumentException("cases must be >= 1: " + cases);
            if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
            if (maxNodes < 1) throw new IllegalArgumentException("maxNodes must be >= 1: " + maxNodes);
            this.cases = cases;
            this.workers = workers;
            this.seed = seed;
            this.maxNodes = maxNodes;
        }

        @Override
        public String toString() {
            return String.format("cases=%d workers=%d seed=%d maxNodes=%d", cases, workers, seed, maxNodes);
        }
    }

    public static final class Failure {
        final Property property;
        final int caseIndex;
        final Node<Integer> original;
        final Node<Integer> shrunk;
        final PropertyViolation violation;

        Failure(final Property property, final int caseIndex, final Node<Integer> original,
                final Node<Integer> shrunk, final PropertyViolation violation) {
            this.property = property;
            this.caseIndex = caseIndex;
            this.original = original;
            this.shrunk = shrunk;
            this.violation = violation;
        }

        public Property property() { return property; }
        public int caseIndex() { return caseIndex; }
        public Node<Integer> original() { return original; }
        public Node<Integer> shrunk() { return shrunk; }
        /** Violation raised by the shrunk tree. */
        public PropertyViolation violation() { return violation; }
    }

    public static final class Report {
        final Settings settings;
        final String candidate;
        final Map<Property, Failure> failures;

        Report(final Settings settings, final String candidate, final Map<Property, Failure> failures) {
            this.settings = settings;
            this.candidate = candidate;
            this.failures = Collections.unmodifiableMap(failures);
        }

        public boolean passed() {
            return failures.isEmpty();
        }

        public Optional<Failure> failure(final Property property) {
            return Optional.ofNullable(failures.get(property));
        }

        public Map<Property, Failure> failures() {
            return failures;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(candidate).append(" traversal, ").append(settings).append('\n');
            for (Property p : Property.values()) {
                Failure f = failures.get(p);
                if (f == null) {
                    sb.append(String.format("  %-12s ok%n", p));
                } else {
                    sb.append(String.format("  %-12s FAILED at case %d, %d -> %d nodes%n    %s%n",
                            p, f.caseIndex, Trees.size(f.original), Trees.size(f.shrunk),
                            f.violation.getMessage().replace("\n", "\n    ")));
                }
            }
            return sb.toString();
        }
    }

    private final Settings settings;
    private final Traversal reference;

    public OracleRunner(final Settings settings, final Traversal reference) {
        this.settings = settings;
        this.reference = reference;
    }

    public Report run(final Traversal candidate) throws InterruptedException {
        LOGGER.info(() -> "checking " + candidate.name() + " against " + reference.name() + " (" + settings + ")");
        final ConcurrentHashMap<Property, Found> first = new ConcurrentHashMap<>();
        ExecutorService pool = Executors.newFixedThreadPool(settings.workers);
        try {
            List<Future<?>> futures = new ArrayList<>(settings.cases);
            for (int i = 0; i < settings.cases; i++) {
                final int caseIndex = i;
                futures.add(pool.submit(() -> runCase(candidate, caseIndex, first)));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("case crashed", e.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
        }

        Map<Property, Failure> failures = new EnumMap<>(Property.class);
        for (Map.Entry<Property, Found> e : first.entrySet()) {
            Failure f = shrink(candidate, e.getKey(), e.getValue());
            LOGGER.warning(() -> f.violation.getMessage());
            failures.put(e.getKey(), f);
        }
        return new Report(settings, candidate.name(), failures);
    }

    private static final class Found {
        final int caseIndex;
        final Node<Integer> tree;

        Found(final int caseIndex, final Node<Integer> tree) {
            this.caseIndex = caseIndex;
            this.tree = tree;
        }
    }

    private void runCase(final Traversal candidate, final int caseIndex, final ConcurrentHashMap<Property, Found> first) {
        Random rnd = new Random(settings.seed + caseIndex);
        Node<Integer> tree = TreeGenerator.random(rnd, settings.maxNodes);

        attempt(Property.COMPLETENESS, caseIndex, tree, first,
                t -> TraversalOracle.checkCompleteness(candidate, t));

        attempt(Property.ORDERING, caseIndex, tree, first, t -> {
            for (int d = 0; d < ORDERING_DRAWS; d++) {
                Optional<OrderingSample<Integer>> sample =
                        OrderingSample.draw(candidate, t, rnd.nextInt(), rnd.nextInt(), rnd.nextInt());
                if (sample.isPresent()) {
                    TraversalOracle.checkOrdering(candidate, t, sample.get());
                    return;
                }
            }
        });

        attempt(Property.EQUIVALENCE, caseIndex, tree, first,
                t -> TraversalOracle.checkEquivalence(reference, candidate, t));
    }

    private static void attempt(final Property property, final int caseIndex, final Node<Integer> tree,
                                final ConcurrentHashMap<Property, Found> first, final Consumer<Node<Integer>> check) {
        try {
            check.accept(tree);
        } catch (PropertyViolation v) {
            LOGGER.fine(() -> "case " + caseIndex + ": " + v.getMessage());
            first.merge(property, new Found(caseIndex, tree),
                    (a, b) -> a.caseIndex <= b.caseIndex ? a : b);
        }
    }

    private Failure shrink(final Traversal candidate, final Property property, final Found found) {
        Consumer<Node<Integer>> check;
        switch (property) {
            case COMPLETENESS:
                check = t -> TraversalOracle.checkCompleteness(candidate, t);
                break;
            case ORDERING:
                check = t -> TraversalOracle.checkOrderingExhaustive(candidate, t);
                break;
            default:
                check = t -> TraversalOracle.checkEquivalence(reference, candidate, t);
                break;
        }
        Node<Integer> shrunk = TreeShrinker.shrink(found.tree, TreeShrinker.violates(check));
        PropertyViolation violation;
        try {
            check.accept(shrunk);
            throw new IllegalStateException("shrunk tree stopped failing: " + Trees.render(shrunk));
        } catch (PropertyViolation v) {
            violation = v;
        }
        return new Failure(property, found.caseIndex, found.tree, shrunk, violation);
    }
}

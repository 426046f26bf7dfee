package bench;

import traversal.OracleRunner;
import traversal.RecursiveTraversal;
import traversal.StackTraversal;

/**
 * Runs the traversal oracle over seeded random trees from the command line.
 * Exits with status 1 when any property fails.
 */
public class OracleCheck {

    public static void main(String[] args) throws Exception {
        int cases = (args.length >= 1) ? Integer.parseInt(args[0]) : 1_000;
        int workers = (args.length >= 2) ? Integer.parseInt(args[1]) : Runtime.getRuntime().availableProcessors();
        long seed = (args.length >= 3) ? Long.parseLong(args[2]) : 42L;
        int maxNodes = (args.length >= 4) ? Integer.parseInt(args[3]) : 64;
        OracleRunner.Settings settings = new OracleRunner.Settings(cases, workers, seed, maxNodes);

        System.out.println("========================================");
        System.out.println("Traversal oracle");
        System.out.println("========================================\n");

        OracleRunner runner = new OracleRunner(settings, RecursiveTraversal.INSTANCE);
        OracleRunner.Report recursive = runner.run(RecursiveTraversal.INSTANCE);
        OracleRunner.Report stack = runner.run(StackTraversal.INSTANCE);
        System.out.println(recursive);
        System.out.println(stack);

        if (recursive.passed() && stack.passed()) {
            System.out.println("✅ ALL PROPERTIES HOLD");
        } else {
            System.err.println("❌ PROPERTY VIOLATIONS FOUND");
            System.exit(1);
        }
    }
}

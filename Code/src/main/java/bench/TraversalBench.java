package bench;

import traversal.Node;
import traversal.RecursiveTraversal;
import traversal.StackTraversal;
import traversal.Traversal;
import traversal.TreeGenerator;
import traversal.Trees;

import java.util.Iterator;
import java.util.Random;

/**
 * Compares the recursive and the explicit-stack traversal on random trees and
 * on tall single-sided spines.
 */
public class TraversalBench {

    static long drain(Traversal t, Node<Integer> root) {
        long sum = 0;
        Iterator<Node<Integer>> it = t.traverse(root);
        while (it.hasNext()) sum += it.next().value();
        return sum;
    }

    static void timeTraversal(Traversal t, Node<Integer> root, int rounds) {
        // warm-up
        for (int i = 0; i < Math.max(1, rounds / 10); i++) drain(t, root);

        long start = System.nanoTime();
        long checksum = 0;
        for (int i = 0; i < rounds; i++) checksum += drain(t, root);
        long elapsed = System.nanoTime() - start;

        double nsPerNode = elapsed / (double) rounds / Trees.size(root);
        System.out.printf("  %-10s %8.2f ns/node  (checksum %d)%n", t.name(), nsPerNode, checksum);
    }

    static void spine(Traversal t, int height) {
        Node<Integer> root = TreeGenerator.spine(height, TreeGenerator.Side.LEFT);
        try {
            long count = 0;
            Iterator<Node<Integer>> it = t.traverse(root);
            while (it.hasNext()) { it.next(); count++; }
            System.out.printf("  %-10s height=%d -> %d nodes%n", t.name(), height, count);
        } catch (StackOverflowError e) {
            System.out.printf("  %-10s height=%d -> StackOverflowError%n", t.name(), height);
        }
    }

    public static void main(String[] args) {
        int nodes = (args.length >= 1) ? Integer.parseInt(args[0]) : 100_000;
        int rounds = (args.length >= 2) ? Integer.parseInt(args[1]) : 50;
        int spineHeight = (args.length >= 3) ? Integer.parseInt(args[2]) : 200_000;

        System.out.println("========================================");
        System.out.println("In-place traversal benchmark");
        System.out.println("========================================\n");

        Node<Integer> root = TreeGenerator.random(new Random(7), nodes);
        System.out.printf("Random tree: %d nodes, height %d, %d rounds%n",
                Trees.size(root), Trees.height(root), rounds);
        timeTraversal(RecursiveTraversal.INSTANCE, root, rounds);
        timeTraversal(StackTraversal.INSTANCE, root, rounds);

        System.out.println("\nLeft spine:");
        spine(StackTraversal.INSTANCE, spineHeight);
        spine(RecursiveTraversal.INSTANCE, spineHeight);
    }
}

package com.sopflow.compiler.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Traversals over nested bodies.
 */
public final class BodyItems {

    private BodyItems() {
    }

    /**
     * Visits every item of the body, descending into all branches, in source order.
     */
    public static void forEach(List<BodyItem> body, Consumer<BodyItem> visitor) {
        for (BodyItem item : body) {
            visitor.accept(item);
            if (item instanceof Conditional conditional) {
                for (Branch branch : conditional.branches()) {
                    forEach(branch.body(), visitor);
                }
            }
        }
    }

    public static List<Transfer> transfers(List<BodyItem> body) {
        List<Transfer> transfers = new ArrayList<>();
        forEach(body, item -> {
            if (item instanceof Transfer transfer) {
                transfers.add(transfer);
            }
        });
        return transfers;
    }

    /**
     * Whether control can reach the end of the body without taking a transfer. A conditional
     * closes every path only when it has an else-branch and each of its branches does.
     */
    public static boolean mayFallThrough(List<BodyItem> body) {
        for (BodyItem item : body) {
            if (item instanceof Transfer) {
                return false;
            }
            if (item instanceof Conditional conditional && closesAllPaths(conditional)) {
                return false;
            }
        }
        return true;
    }

    private static boolean closesAllPaths(Conditional conditional) {
        if (conditional.elseBranchCount() == 0) {
            return false;
        }
        return conditional.branches().stream().noneMatch(branch -> mayFallThrough(branch.body()));
    }

    public static int count(List<BodyItem> body) {
        int[] total = {0};
        forEach(body, item -> total[0]++);
        return total[0];
    }
}

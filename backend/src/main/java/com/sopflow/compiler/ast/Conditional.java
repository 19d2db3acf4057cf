package com.sopflow.compiler.ast;

import java.util.List;

public record Conditional(List<Branch> branches, int line) implements BodyItem {

    public Conditional {
        branches = List.copyOf(branches);
    }

    @Override
    public BodyItemKind kind() {
        return BodyItemKind.CONDITIONAL;
    }

    public long conditionBranchCount() {
        return branches.stream().filter(branch -> !branch.isElse()).count();
    }

    public long elseBranchCount() {
        return branches.stream().filter(Branch::isElse).count();
    }
}

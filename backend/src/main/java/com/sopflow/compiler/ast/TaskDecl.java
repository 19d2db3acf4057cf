package com.sopflow.compiler.ast;

import java.util.List;
import java.util.Optional;

public record TaskDecl(String id, String title, List<BodyItem> body, int line) {

    public TaskDecl {
        body = List.copyOf(body);
    }

    /**
     * Target of the last transfer written at the top level of the body. Branches that end
     * without a transfer of their own continue here.
     */
    public Optional<String> trailingTarget() {
        for (int i = body.size() - 1; i >= 0; i--) {
            if (body.get(i) instanceof Transfer transfer) {
                return Optional.of(transfer.target());
            }
        }
        return Optional.empty();
    }

    public TaskDecl withBody(List<BodyItem> newBody) {
        return new TaskDecl(id, title, newBody, line);
    }

    public TaskDecl withTitle(String newTitle) {
        return new TaskDecl(id, newTitle, body, line);
    }

    public boolean isTerminal() {
        return Terminal.is(id);
    }
}

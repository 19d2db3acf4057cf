package com.sopflow.compiler.ast;

/**
 * An item of a task or branch body. Implementations are the records of this package, one per
 * {@link BodyItemKind}; code dispatches with a switch on {@link #kind()}.
 */
public interface BodyItem {

    BodyItemKind kind();

    int line();
}

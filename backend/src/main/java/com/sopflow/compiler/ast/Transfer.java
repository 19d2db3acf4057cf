package com.sopflow.compiler.ast;

/**
 * A body item that moves control to another task or to the terminal.
 */
public interface Transfer extends BodyItem {

    String target();

    Transfer retarget(String target);
}

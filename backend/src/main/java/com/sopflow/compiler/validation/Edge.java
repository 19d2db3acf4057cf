package com.sopflow.compiler.validation;

/**
 * Control-flow edge between two tasks, or from a task to the terminal.
 *
 * @param from     source task id
 * @param to       target task id or {@code END}
 * @param line     line of the transfer, or of the task header for an implicit edge
 * @param implicit whether the edge comes from the task body falling through to the terminal
 */
public record Edge(String from, String to, int line, boolean implicit) {
}

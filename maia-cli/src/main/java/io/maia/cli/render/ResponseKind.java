package io.maia.cli.render;

/**
 * Shape of the JSON payload a command expects, which decides how it is tabulated.
 */
public enum ResponseKind {
    /** {@code data} is a list of strings. */
    VALUE_LIST,
    /** {@code data} is a list of label sets. */
    LABEL_SETS,
    /** {@code data} is a query result with a result type. */
    QUERY_RESULT
}

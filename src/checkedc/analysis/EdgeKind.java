package checkedc.analysis;

/**
 * Kinds of control-flow edges between basic blocks. The kind is stored as the
 * successor and predecessor data of the edge.
 */
public enum EdgeKind {
    /** Taken when the branch condition is non-zero. */
    TRUE,
    /** Taken when the branch condition is zero. */
    FALSE,
    /** From a switch block to the block of a case label. */
    CASE,
    /** From a switch block to its default label or, without one, its exit. */
    DEFAULT,
    /** From the end of a case body into the next label. */
    FALLTHROUGH,
    /** Any other jump or sequential flow. */
    UNCONDITIONAL
}

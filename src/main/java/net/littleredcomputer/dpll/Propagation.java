package net.littleredcomputer.dpll;

/**
 * How much simplification a search node performs before it branches.
 */
public enum Propagation {
    /** One round of unit propagation followed by one round of pure literal elimination. */
    SINGLE_PASS,
    /** Repeat both rounds until neither assigns anything new. */
    FIXED_POINT
}

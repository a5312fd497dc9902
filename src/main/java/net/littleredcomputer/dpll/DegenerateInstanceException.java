package net.littleredcomputer.dpll;

/**
 * Thrown when a formula would have no variables at all. Such an instance is never handed to a solver.
 */
public class DegenerateInstanceException extends IllegalArgumentException {
    DegenerateInstanceException(int nVariables) {
        super("Must have at least one variable (found " + nVariables + ")");
    }
}

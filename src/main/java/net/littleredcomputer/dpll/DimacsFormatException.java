package net.littleredcomputer.dpll;

/**
 * Thrown when DIMACS CNF input cannot be read as a problem instance.
 */
public class DimacsFormatException extends IllegalArgumentException {
    private final int lineNumber;

    DimacsFormatException(String message) {
        this(message, 0);
    }

    DimacsFormatException(String message, int lineNumber) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    /** @return the 1-based input line at fault, or 0 if the problem is not tied to a line */
    public int lineNumber() {
        return lineNumber;
    }
}

package net.littleredcomputer.dpll;

/**
 * A ternary value for each variable of a formula: 0 (unassigned), 1 (true) or -1 (false).
 * Variables are 1-based, as in the formula.
 */
public final class PartialAssignment {
    private final int[] values;

    public PartialAssignment(int nVariables) {
        if (nVariables < 1) throw new DegenerateInstanceException(nVariables);
        values = new int[nVariables];
    }

    public int nVariables() {
        return values.length;
    }

    public int get(int variable) {
        return values[variable - 1];
    }

    public void set(int variable, int value) {
        if (value < -1 || value > 1) throw new IllegalArgumentException("not a ternary value: " + value);
        values[variable - 1] = value;
    }

    public boolean isAssigned(int variable) {
        return values[variable - 1] != 0;
    }

    /**
     * @param literal a signed variable number
     * @return 1 if the literal is true, -1 if it is false, 0 if its variable is unassigned
     */
    public int valueOf(int literal) {
        int v = values[Math.abs(literal) - 1];
        return literal > 0 ? v : -v;
    }

    /** Make the literal true. */
    public void makeTrue(int literal) {
        values[Math.abs(literal) - 1] = literal > 0 ? 1 : -1;
    }

    public int[] snapshot() {
        return values.clone();
    }

    /**
     * @return the assignment as a point, element v-1 holding the value of variable v
     * @throws IllegalStateException if some variable is unassigned
     */
    public boolean[] toSolution() {
        boolean[] solution = new boolean[values.length];
        for (int i = 0; i < values.length; ++i) {
            if (values[i] == 0) throw new IllegalStateException("variable " + (i + 1) + " is unassigned");
            solution[i] = values[i] > 0;
        }
        return solution;
    }

    /** One character per variable: + for true, - for false, . for unassigned. */
    @Override
    public String toString() {
        StringBuilder s = new StringBuilder(values.length);
        for (int v : values) s.append(v > 0 ? '+' : v < 0 ? '-' : '.');
        return s.toString();
    }
}

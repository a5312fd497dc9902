package net.littleredcomputer.dpll;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable propositional formula in conjunctive normal form. Variables are numbered from 1;
 * a literal is a nonzero int whose sign gives its polarity.
 */
public class CNFFormula {
    private static final Logger log = LogManager.getFormatterLogger(CNFFormula.class);
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+(-?[0-9]+)\\s+(-?[0-9]+)");
    /** Largest variable number accepted, the same bound the GraphBase generators use. */
    public static final int MAX_VARIABLES = 99999999;
    private final static Splitter splitter = Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();
    private final int nVariables;
    private final ImmutableList<ImmutableList<Integer>> clauses;
    private final int nLiterals;
    private final int declaredClauses;
    private final int droppedTautologies;

    private CNFFormula(Builder b) {
        this.nVariables = b.nVariables;
        this.clauses = b.clauses.build();
        this.nLiterals = b.nLiterals;
        this.declaredClauses = b.declaredClauses;
        this.droppedTautologies = b.droppedTautologies;
    }

    public int nVariables() {
        return nVariables;
    }

    public int nClauses() {
        return clauses.size();
    }

    public int nLiterals() {
        return nLiterals;
    }

    /** @return the clause count announced by the p line, or -1 if the formula was not read from DIMACS */
    public int declaredClauses() {
        return declaredClauses;
    }

    /** @return how many clauses were discarded because they contained a literal and its complement */
    public int droppedTautologies() {
        return droppedTautologies;
    }

    public ImmutableList<ImmutableList<Integer>> clauses() {
        return clauses;
    }

    public ImmutableList<Integer> getClause(int i) {
        return clauses.get(i);
    }

    /**
     * Evaluate the boolean function represented by the formula's clauses at the specified point
     * @param p point at which to evaluate; p[v-1] is the value of variable v
     * @return the truth value of this formula at p
     */
    public boolean evaluate(boolean[] p) {
        if (p.length < nVariables) throw new IllegalArgumentException("point has " + p.length + " values, need " + nVariables);
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[Math.abs(literal) - 1] == (literal > 0)) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    public static Builder builder(int declaredVariables) {
        return new Builder(declaredVariables);
    }

    /**
     * Accumulates clauses. The variable count starts at the declared value and grows to cover
     * every variable a clause mentions.
     */
    public static class Builder {
        private final ImmutableList.Builder<ImmutableList<Integer>> clauses = ImmutableList.builder();
        private int nVariables;
        private int nLiterals = 0;
        private int declaredClauses = -1;
        private int droppedTautologies = 0;

        Builder(int declaredVariables) {
            this.nVariables = declaredVariables;
        }

        Builder declaredClauses(int n) {
            declaredClauses = n;
            return this;
        }

        /**
         * Add a clause. Repeated literals are merged and the literals are kept in ascending order.
         * A clause containing both l and -l is always true and is dropped.
         */
        public Builder addClause(Iterable<Integer> literals) {
            TreeSet<Integer> distinct = new TreeSet<>();
            for (int l : literals) {
                if (l == 0) throw new IllegalArgumentException("0 is not a literal");
                if (l == Integer.MIN_VALUE) throw new IllegalArgumentException("literal out of range: " + l);
                distinct.add(l);
            }
            for (int l : distinct) {
                if (l > 0) break;
                if (distinct.contains(-l)) {
                    ++droppedTautologies;
                    return this;
                }
            }
            for (int l : distinct) nVariables = Math.max(nVariables, Math.abs(l));
            nLiterals += distinct.size();
            clauses.add(ImmutableList.copyOf(distinct));
            return this;
        }

        public Builder addClause(Integer... literals) {
            return addClause(ImmutableList.copyOf(literals));
        }

        public CNFFormula build() {
            if (nVariables < 1) throw new DegenerateInstanceException(nVariables);
            if (nVariables > MAX_VARIABLES) throw new DimacsFormatException("too many variables: " + nVariables + " (at most " + MAX_VARIABLES + ")");
            return new CNFFormula(this);
        }
    }

    public static CNFFormula parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Read a formula in DIMACS CNF format. Lines ahead of the p line are ignored, as is anything
     * after the 0 that ends a clause line. A clause line lacking its 0 ends at the end of the line.
     */
    public static CNFFormula parseFrom(Reader r) {
        Builder b = null;
        List<Integer> literals = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader br = new BufferedReader(r)) {
            String line;
            while ((line = br.readLine()) != null) {
                ++lineNumber;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("c")) continue;
                if (line.startsWith("%")) break;  // SATLIB end of data
                if (line.startsWith("p")) {
                    if (b != null) throw new DimacsFormatException("duplicate p line", lineNumber);
                    Matcher m = pLineRe.matcher(line);
                    if (!m.matches()) throw new DimacsFormatException("invalid p line: " + line, lineNumber);
                    b = new Builder(parseInt(m.group(1), lineNumber)).declaredClauses(parseInt(m.group(2), lineNumber));
                    continue;
                }
                if (b == null) continue;
                literals.clear();
                for (String token : splitter.split(line)) {
                    int l = parseInt(token, lineNumber);
                    if (l == 0) break;
                    if (l == Integer.MIN_VALUE) throw new DimacsFormatException("literal out of range: " + token, lineNumber);
                    literals.add(l);
                }
                b.addClause(literals);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (b == null) throw new DimacsFormatException("missing p line");
        CNFFormula f = b.build();
        if (f.declaredClauses != f.nClauses() + f.droppedTautologies) {
            log.warn("p line declares %d clauses, but %d were read", f.declaredClauses, f.nClauses() + f.droppedTautologies);
        }
        return f;
    }

    private static int parseInt(String token, int lineNumber) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new DimacsFormatException("not an integer: " + token, lineNumber);
        }
    }

    /**
     * Generate a random instance. Each clause has one literal with probability 1/100, two with
     * probability 30/100 and three otherwise (never more than there are variables). The variables
     * within a clause are distinct and each is negated with probability 1/2.
     *
     * @param n    number of variables
     * @param m    number of clauses
     * @param seed for random number generator
     * @return random CNF instance
     */
    public static CNFFormula randomInstance(int n, int m, int seed) {
        if (n <= 0 || n > MAX_VARIABLES) throw new IllegalArgumentException("n must be between 1 and " + MAX_VARIABLES);
        if (m < 0) throw new IllegalArgumentException("m mustn't be negative!");
        final SGBRandom R = new SGBRandom(seed);
        Builder b = new Builder(n);
        for (int j = 0; j < m; ++j) {
            int r = R.unifRand(100);
            int k = Math.min(r < 1 ? 1 : r < 31 ? 2 : 3, n);
            b.addClause(Ints.asList(R.distinctLiterals(k, n)));
        }
        return b.build();
    }

    /**
     * Generate the van der Waerden problem waerden(j, k; n): find a binary string of length n with
     * no j equally spaced 0s and no k equally spaced 1s. It is satisfiable iff n &lt; W(j, k).
     *
     * @param j Number of equally spaced 0s to forbid
     * @param k Number of equally spaced 1s to forbid
     * @param n Length of binary string
     * @return the problem instance
     */
    public static CNFFormula waerden(int j, int k, int n) {
        Builder b = new Builder(n);
        forbidProgressions(b, j, n, 1);
        forbidProgressions(b, k, n, -1);
        return b.build();
    }

    private static void forbidProgressions(Builder b, int length, int n, int sign) {
        for (int d = 1; d == 1 || (length > 1 && 1 + (length - 1) * d <= n); ++d) {
            for (int i = 1; i + (length - 1) * d <= n; ++i) {
                List<Integer> clause = new ArrayList<>(length);
                for (int h = 0; h < length; ++h) clause.add(sign * (i + d * h));
                b.addClause(clause);
            }
        }
    }
}

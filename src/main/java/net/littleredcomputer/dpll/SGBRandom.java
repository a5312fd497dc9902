package net.littleredcomputer.dpll;

import com.google.common.primitives.UnsignedInts;

/**
 * The random number generator from the Stanford GraphBase, plus the draws the random CNF
 * generator makes from it.
 */
public class SGBRandom {
    private static final int two_to_the_31 = 0x80000000;
    private final int[] A = new int[56];
    private int gb_fptr = 0;

    /* difference mod 2^31 */
    private int mod_diff(int x, int y) { return (x-y) & 0x7fffffff; }

    /**
     *  A random number generator bit-compatible with that provided by gb_flip.h in the
     *  Stanford GraphBase.
     *  @param seed used to initialize the RNG. The seed gives predictable results; there
     *              is no other influence on the random numbers produced.
     */
    public SGBRandom(int seed) {
        A[0] = -1;
        int prev = seed, next = 1;
        seed = prev = mod_diff(prev, 0);
        A[55] = prev;
        for (int i = 21; i != 0; i = (i+21)%55) {
            A[i] = next;
            // Compute a new next value, based on next, prev, and seed.
            next = mod_diff(prev, next);
            if ((seed & 1) != 0) seed = 0x40000000+(seed>>1);
            else seed >>= 1;
            next = mod_diff(next, seed);
            prev = A[i];
        }
        // Get the array values "warmed up"
        for (int i = 0; i < 5; ++i) gb_flip_cycle();
    }

    public int nextRand() {
        return A[gb_fptr] >= 0 ? A[gb_fptr--] : gb_flip_cycle();
    }

    public int unifRand(int m) {
        if (m <= 0) throw new IllegalArgumentException("bound must be positive: " + m);
        int t = two_to_the_31 - UnsignedInts.remainder(two_to_the_31, m);
        int r;
        do r = nextRand(); while (UnsignedInts.compare(t, r) <= 0);
        return r % m;
    }

    /** @return true or false with equal probability, from the low bit of the next value */
    public boolean flip() {
        return (nextRand() & 1) == 0;
    }

    /**
     * Draw k literals over distinct variables in [1, n]. Each variable is chosen uniformly among
     * those not yet used and then negated if a coin flip says so.
     *
     * @param k number of literals, at most n
     * @param n number of variables
     * @return the literals in the order drawn
     */
    public int[] distinctLiterals(int k, int n) {
        if (k < 0 || k > n) throw new IllegalArgumentException("cannot draw " + k + " distinct variables from " + n);
        int[] literals = new int[k];
        DRAW:
        for (int i = 0; i < k; ) {
            int v = unifRand(n) + 1;
            for (int h = 0; h < i; ++h) if (Math.abs(literals[h]) == v) continue DRAW;
            literals[i++] = flip() ? v : -v;
        }
        return literals;
    }

    private int gb_flip_cycle() {
        int i, j;
        for (i = 1, j = 32; j <= 55; i++, j++) A[i] = mod_diff(A[i], A[j]);
        for (j = 1; i <= 55; i++, j++) A[i] = mod_diff(A[i], A[j]);
        gb_fptr = 54;
        return A[55];
    }
}

package net.littleredcomputer.dpll;

import org.junit.Test;

import java.util.Arrays;
import java.util.stream.IntStream;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertThat;

public class SGBRandomTest {

    @Test
    public void matchesGraphBase() {
        // Check values given in gb_flip.w of the Stanford GraphBase.
        SGBRandom R = new SGBRandom(-314159);
        assertThat(R.nextRand(), is(119318998));
        for (int j = 1; j <= 133; j++) R.nextRand();
        assertThat(R.unifRand(0x55555555), is(748103812));
    }

    @Test
    public void unifRandStaysInRange() {
        SGBRandom R = new SGBRandom(42);
        for (int i = 0; i < 1000; ++i) assertThat(R.unifRand(7), is(allOf(greaterThanOrEqualTo(0), lessThan(7))));
    }

    @Test
    public void distinctLiterals() {
        SGBRandom R = new SGBRandom(271828);
        for (int t = 0; t < 200; ++t) {
            int n = 1 + R.unifRand(6);
            int[] literals = R.distinctLiterals(n, n);
            // Drawing every variable must produce each exactly once, in either polarity.
            assertThat(Arrays.stream(literals).map(Math::abs).sorted().toArray(), is(IntStream.rangeClosed(1, n).toArray()));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void cannotDrawMoreVariablesThanExist() {
        new SGBRandom(1).distinctLiterals(4, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void boundMustBePositive() {
        new SGBRandom(1).unifRand(0);
    }
}

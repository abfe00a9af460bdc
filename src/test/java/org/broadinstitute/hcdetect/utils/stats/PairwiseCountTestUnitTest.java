package org.broadinstitute.hcdetect.utils.stats;

import org.broadinstitute.hcdetect.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Unit tests for {@link PairwiseCountTest}.
 */
public final class PairwiseCountTestUnitTest extends BaseTest {
    private static final double DELTA_PRECISION = 10e-9;

    private Random random;

    @BeforeMethod
    public void reseedRandom() {
        random = new Random(47L);
    }

    @DataProvider(name = "singleFeature")
    public Object[][] makeSingleFeature() {
        // expected values are the two binomial tails added by hand
        final List<Object[]> tests = new ArrayList<>();
        tests.add(new Object[]{0, 0, 10, 10, 1.0});
        tests.add(new Object[]{5, 5, 5, 5, 1.0});
        tests.add(new Object[]{3, 1, 4, 4, 0.05078125});
        tests.add(new Object[]{1, 3, 4, 4, 0.05078125});
        tests.add(new Object[]{0, 10, 10, 20, 2.0 / 1024});
        tests.add(new Object[]{10, 0, 10, 20, 0.0});
        tests.add(new Object[]{4, 4, 10, 10, 1.0});
        return tests.toArray(new Object[][]{});
    }

    @Test(dataProvider = "singleFeature")
    public void testTwoSidedPValue(final int countA, final int countB, final int totalA, final int totalB, final double expected) {
        Assert.assertEquals(PairwiseCountTest.twoSidedPValue(countA, countB, totalA, totalB), expected, DELTA_PRECISION);
    }

    @Test
    public void testIdenticalSamplesAreNotSignificant() {
        final int[] counts = {7, 0, 12, 3, 1};
        for (final double p : PairwiseCountTest.pValues(counts, counts.clone())) {
            Assert.assertEquals(p, 1.0, DELTA_PRECISION);
        }
    }

    @Test
    public void testEmptySample() {
        final double[] pValues = PairwiseCountTest.pValues(new int[]{0, 0, 0}, new int[]{1, 2, 3});
        assertEqualsDoubleArray(pValues, new double[]{1, 1, 1}, DELTA_PRECISION);
    }

    @Test
    public void testDisjointSamples() {
        final double[] pValues = PairwiseCountTest.pValues(new int[]{5, 0}, new int[]{0, 5});
        Assert.assertEquals(pValues[0], 0.0);
        Assert.assertEquals(pValues[1], 0.0);
    }

    @Test
    public void testRangeAndSymmetry() {
        for (int trial = 0; trial < 20; trial++) {
            final int[] a = new int[30];
            final int[] b = new int[30];
            for (int i = 0; i < a.length; i++) {
                a[i] = random.nextInt(20);
                b[i] = random.nextInt(40);
            }
            final double[] ab = PairwiseCountTest.pValues(a, b);
            final double[] ba = PairwiseCountTest.pValues(b, a);
            for (int i = 0; i < ab.length; i++) {
                Assert.assertTrue(ab[i] >= 0 && ab[i] <= 1, "p-value out of range: " + ab[i]);
                Assert.assertEquals(ab[i], ba[i], DELTA_PRECISION);
            }
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDifferentLengths() {
        PairwiseCountTest.pValues(new int[]{1, 2}, new int[]{1, 2, 3});
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeCount() {
        PairwiseCountTest.pValues(new int[]{1, -2}, new int[]{1, 2});
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullCounts() {
        PairwiseCountTest.pValues(null, new int[]{1, 2});
    }
}

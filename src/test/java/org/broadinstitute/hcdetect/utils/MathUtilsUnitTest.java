package org.broadinstitute.hcdetect.utils;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.hcdetect.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class MathUtilsUnitTest extends BaseTest {

    @Test
    public void testSums() {
        Assert.assertEquals(MathUtils.sum(new int[]{Integer.MAX_VALUE, Integer.MAX_VALUE}), 2L * Integer.MAX_VALUE);
        Assert.assertEquals(MathUtils.sum(new double[]{0.5, 1.5, 2.0}), 4.0);

        final RealMatrix matrix = new Array2DRowRealMatrix(new double[][]{{1, 2, 3}, {4, 5, 6}});
        Assert.assertEquals(MathUtils.columnSums(matrix), new double[]{5, 7, 9});
        Assert.assertEquals(MathUtils.rowSums(matrix), new double[]{6, 15});
    }

    @Test
    public void testCosineSimilarity() {
        Assert.assertEquals(MathUtils.cosineSimilarity(new int[]{1, 2, 0}, new int[]{3, 6, 0}), 1.0, 1e-12);
        Assert.assertEquals(MathUtils.cosineSimilarity(new int[]{1, 0}, new int[]{0, 7}), 0.0, 1e-12);
        Assert.assertEquals(MathUtils.cosineSimilarity(new int[]{1, 1}, new int[]{1, 0}), Math.sqrt(0.5), 1e-12);
        Assert.assertTrue(Double.isNaN(MathUtils.cosineSimilarity(new int[]{0, 0}, new int[]{1, 0})));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCosineSimilarityLengthMismatch() {
        MathUtils.cosineSimilarity(new int[]{1, 2}, new int[]{1});
    }
}

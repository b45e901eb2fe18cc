package org.broadinstitute.graphseg.segmentation;

import org.broadinstitute.graphseg.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class BreakpointMetricsUnitTest extends BaseTest {

    @DataProvider(name = "hausdorff")
    public Object[][] hausdorff() {
        return new Object[][]{
                {Arrays.asList(50, 100), Arrays.asList(50, 100), 0.},
                {Arrays.asList(50, 100), Arrays.asList(53, 100), 3.},
                {Arrays.asList(20, 80, 100), Arrays.asList(22, 100), 58.},
                {Arrays.asList(10, 60, 100), Arrays.asList(12, 55, 100), 5.},
                {Collections.singletonList(100), Collections.singletonList(100), 0.},
                {Collections.singletonList(100), Arrays.asList(50, 100), Double.POSITIVE_INFINITY},
                {Arrays.asList(50, 100), Collections.singletonList(100), Double.POSITIVE_INFINITY}
        };
    }

    @Test(dataProvider = "hausdorff")
    public void testHausdorff(final List<Integer> first, final List<Integer> second, final double expected) {
        Assert.assertEquals(BreakpointMetrics.hausdorff(first, second), expected, 0.);
        Assert.assertEquals(BreakpointMetrics.hausdorff(second, first), expected, 0.);
    }

    @DataProvider(name = "precisionRecall")
    public Object[][] precisionRecall() {
        return new Object[][]{
                {Arrays.asList(50, 100), Arrays.asList(52, 100), 5, 1., 1.},
                {Arrays.asList(50, 100), Arrays.asList(52, 100), 1, 0., 0.},
                {Arrays.asList(30, 60, 100), Arrays.asList(31, 100), 2, 1., 0.5},
                {Arrays.asList(50, 100), Arrays.asList(20, 49, 80, 100), 2, 1. / 3., 1.},
                // a true changepoint is matched at most once
                {Arrays.asList(50, 100), Arrays.asList(49, 51, 100), 2, 0.5, 1.},
                {Collections.singletonList(100), Collections.singletonList(100), 0, 1., 1.},
                {Collections.singletonList(100), Arrays.asList(50, 100), 3, 0., 0.},
                {Arrays.asList(50, 100), Collections.singletonList(100), 3, 0., 0.}
        };
    }

    @Test(dataProvider = "precisionRecall")
    public void testPrecisionRecall(final List<Integer> truth, final List<Integer> predicted, final int margin,
                                    final double expectedPrecision, final double expectedRecall) {
        final BreakpointMetrics.PrecisionRecall result = BreakpointMetrics.precisionRecall(truth, predicted, margin);
        Assert.assertEquals(result.getPrecision(), expectedPrecision, 1e-12);
        Assert.assertEquals(result.getRecall(), expectedRecall, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDifferentSignalLengths() {
        BreakpointMetrics.hausdorff(Arrays.asList(50, 100), Arrays.asList(50, 101));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyBreakpoints() {
        BreakpointMetrics.precisionRecall(Collections.emptyList(), Collections.singletonList(10), 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeMargin() {
        BreakpointMetrics.precisionRecall(Arrays.asList(50, 100), Arrays.asList(50, 100), -1);
    }
}

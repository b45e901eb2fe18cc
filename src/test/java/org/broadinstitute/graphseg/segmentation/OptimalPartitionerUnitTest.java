package org.broadinstitute.graphseg.segmentation;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.graphseg.exceptions.UserException;
import org.broadinstitute.graphseg.segmentation.cost.FittedSegmentCost;
import org.broadinstitute.graphseg.segmentation.cost.L2Cost;
import org.broadinstitute.graphseg.testutils.BaseTest;
import org.broadinstitute.graphseg.testutils.SyntheticSignals;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class OptimalPartitionerUnitTest extends BaseTest {

    private static final double EPSILON = 1e-9;

    private static final OptimalPartitioner PARTITIONER = new OptimalPartitioner();

    private static double penalizedCost(final FittedSegmentCost cost, final List<Integer> breakpoints, final double penalty) {
        double total = 0.;
        int start = 0;
        for (final int end : breakpoints) {
            total += cost.error(start, end);
            start = end;
        }
        return total + penalty * (breakpoints.size() - 1);
    }

    private static void assertAdmissible(final List<Integer> breakpoints, final int numPoints, final int jump, final int minSize) {
        Assert.assertFalse(breakpoints.isEmpty());
        Assert.assertEquals((int) breakpoints.get(breakpoints.size() - 1), numPoints);
        int start = 0;
        for (int i = 0; i < breakpoints.size(); i++) {
            final int end = breakpoints.get(i);
            Assert.assertTrue(end - start >= minSize, "segment [" + start + ", " + end + ") is shorter than " + minSize);
            if (i < breakpoints.size() - 1) {
                Assert.assertEquals(end % jump, 0, "changepoint " + end + " is not a multiple of " + jump);
            }
            start = end;
        }
    }

    /**
     * Optimal partitioning without pruning, over the same grid of admissible changepoints.
     */
    private static double unprunedOptimalCost(final FittedSegmentCost cost, final double penalty, final int jump, final int minSize) {
        final int numPoints = cost.getNumPoints();
        final List<Integer> positions = new ArrayList<>();
        positions.add(0);
        for (int position = jump; position < numPoints; position += jump) {
            positions.add(position);
        }
        positions.add(numPoints);
        final double[] best = new double[positions.size()];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        best[0] = -penalty;
        for (int i = 1; i < positions.size(); i++) {
            for (int k = 0; k < i; k++) {
                if (positions.get(i) - positions.get(k) >= minSize && best[k] < Double.POSITIVE_INFINITY) {
                    best[i] = Math.min(best[i], best[k] + cost.error(positions.get(k), positions.get(i)) + penalty);
                }
            }
        }
        return best[positions.size() - 1];
    }

    @DataProvider(name = "bruteForce")
    public Object[][] bruteForce() {
        final List<Object[]> cases = new ArrayList<>();
        for (final int numPoints : new int[]{6, 11, 12}) {
            for (final int jump : new int[]{1, 2}) {
                for (final int minSize : new int[]{1, 2, 3}) {
                    for (final double penalty : new double[]{0., 0.5, 2., 10.}) {
                        cases.add(new Object[]{numPoints, jump, minSize, penalty});
                    }
                }
            }
        }
        return cases.toArray(new Object[cases.size()][]);
    }

    @Test(dataProvider = "bruteForce")
    public void testAgreesWithExhaustiveSearch(final int numPoints, final int jump, final int minSize, final double penalty) {
        final RealMatrix signal = SyntheticSignals.piecewiseConstant(Arrays.asList(numPoints / 3, numPoints),
                new double[][]{{0., 1.}, {1.5, -0.5}}, 0.7, SyntheticSignals.seededGenerator(numPoints * 100 + jump * 10 + minSize));
        final FittedSegmentCost cost = new L2Cost().fit(signal);

        double bestCost = Double.POSITIVE_INFINITY;
        for (final List<Integer> candidate : SyntheticSignals.allAdmissiblePartitions(numPoints, jump, minSize)) {
            bestCost = Math.min(bestCost, penalizedCost(cost, candidate, penalty));
        }

        final Partition partition = PARTITIONER.findOptimalPartition(cost, penalty, jump, minSize);
        assertAdmissible(partition.getBreakpoints(), numPoints, jump, minSize);
        Assert.assertEquals(partition.getCost(), bestCost, EPSILON);
        Assert.assertEquals(penalizedCost(cost, partition.getBreakpoints(), penalty), bestCost, EPSILON);
    }

    @DataProvider(name = "unpruned")
    public Object[][] unpruned() {
        return new Object[][]{
                {1, 1, 1.}, {1, 1, 5.}, {1, 4, 3.}, {3, 1, 3.}, {2, 5, 1.}, {4, 3, 8.}
        };
    }

    @Test(dataProvider = "unpruned")
    public void testAgreesWithUnprunedSearch(final int jump, final int minSize, final double penalty) {
        final RealMatrix signal = SyntheticSignals.piecewiseConstant(Arrays.asList(8, 17, 30),
                new double[][]{{0., 0., 0.}, {2., -1., 0.5}, {-1., 1., 1.}}, 0.8, SyntheticSignals.seededGenerator(jump * 7 + minSize));
        final FittedSegmentCost cost = new L2Cost().fit(signal);
        final Partition partition = PARTITIONER.findOptimalPartition(cost, penalty, jump, minSize);
        assertAdmissible(partition.getBreakpoints(), 30, jump, minSize);
        Assert.assertEquals(partition.getCost(), unprunedOptimalCost(cost, penalty, jump, minSize), EPSILON);
    }

    @Test
    public void testRecoversWellSeparatedChanges() {
        final List<Integer> truth = Arrays.asList(40, 90, 150);
        final RealMatrix signal = SyntheticSignals.piecewiseConstant(truth,
                new double[][]{{0., 0.}, {3., 0.}, {3., -3.}}, 0.5, SyntheticSignals.seededGenerator(21));
        final List<Integer> breakpoints = PARTITIONER.search(new L2Cost().fit(signal), 10., 1, 1);
        Assert.assertEquals(breakpoints.size(), truth.size());
        Assert.assertTrue(BreakpointMetrics.hausdorff(breakpoints, truth) <= 2., breakpoints.toString());
    }

    @Test
    public void testConstantSignalHasNoChangepoints() {
        final FittedSegmentCost cost = new L2Cost().fit(SyntheticSignals.constantSignal(50, new double[]{1.5, -2.}));
        Assert.assertEquals(PARTITIONER.search(cost, 1., 1, 1), Collections.singletonList(50));
        Assert.assertEquals(PARTITIONER.search(cost, 1., 3, 4), Collections.singletonList(50));
    }

    @Test
    public void testZeroPenaltyCanSplitEveryPoint() {
        final RealMatrix signal = SyntheticSignals.randomSignal(8, 1, SyntheticSignals.seededGenerator(4));
        final Partition partition = PARTITIONER.findOptimalPartition(new L2Cost().fit(signal), 0., 1, 1);
        Assert.assertEquals(partition.getCost(), 0., EPSILON);
    }

    @Test
    public void testChangepointsLieOnTheGrid() {
        final RealMatrix signal = SyntheticSignals.piecewiseConstant(Arrays.asList(23, 51, 77, 103),
                new double[][]{{0.}, {2.}, {-1.}, {1.}}, 0.3, SyntheticSignals.seededGenerator(9));
        for (final int jump : new int[]{2, 5, 10}) {
            for (final int minSize : new int[]{1, 7}) {
                final List<Integer> breakpoints = PARTITIONER.search(new L2Cost().fit(signal), 2., jump, minSize);
                assertAdmissible(breakpoints, 103, jump, minSize);
                Assert.assertTrue(breakpoints.size() > 1);
            }
        }
    }

    @Test
    public void testShortSignalIsASingleSegment() {
        final FittedSegmentCost cost = new L2Cost().fit(SyntheticSignals.randomSignal(5, 2, SyntheticSignals.seededGenerator(6)));
        final Partition partition = PARTITIONER.findOptimalPartition(cost, 0., 1, 3);
        Assert.assertEquals(partition.getBreakpoints(), Collections.singletonList(5));
        Assert.assertEquals(partition.getCost(), cost.error(0, 5), 0.);

        final FittedSegmentCost singlePoint = new L2Cost().fit(new double[][]{{4.}});
        Assert.assertEquals(PARTITIONER.search(singlePoint, 1., 1, 1), Collections.singletonList(1));
    }

    @DataProvider(name = "extremeGrids")
    public Object[][] extremeGrids() {
        return new Object[][]{
                {1, Integer.MAX_VALUE},
                {1, 1 << 30},
                {Integer.MAX_VALUE, 1},
                {Integer.MAX_VALUE, 2},
                {Integer.MAX_VALUE - 1, Integer.MAX_VALUE},
                {1 << 30, 3}
        };
    }

    @Test(dataProvider = "extremeGrids")
    public void testExtremeGridParametersGiveASingleSegment(final int jump, final int minSize) {
        final RealMatrix signal = SyntheticSignals.piecewiseConstant(Arrays.asList(5, 10),
                new double[][]{{0.}, {100.}}, 0.1, SyntheticSignals.seededGenerator(10));
        final FittedSegmentCost cost = new L2Cost().fit(signal);
        final Partition partition = PARTITIONER.findOptimalPartition(cost, 1., jump, minSize);
        Assert.assertEquals(partition.getBreakpoints(), Collections.singletonList(10));
        Assert.assertEquals(partition.getCost(), cost.error(0, 10), EPSILON);
    }

    @Test
    public void testMinimumSizeOfHalfTheSignal() {
        final RealMatrix signal = SyntheticSignals.piecewiseConstant(Arrays.asList(5, 10),
                new double[][]{{0.}, {100.}}, 0.1, SyntheticSignals.seededGenerator(10));
        final FittedSegmentCost cost = new L2Cost().fit(signal);
        Assert.assertEquals(PARTITIONER.search(cost, 1., 1, 5), Arrays.asList(5, 10));
        Assert.assertEquals(PARTITIONER.search(cost, 1., 1, 6), Collections.singletonList(10));
        Assert.assertEquals(PARTITIONER.search(new L2Cost().fit(signal.getSubMatrix(0, 8, 0, 0)), 1., 1, 5),
                Collections.singletonList(9));
    }

    @Test
    public void testLargerPenaltyNeverAddsChangepoints() {
        final RealMatrix signal = SyntheticSignals.piecewiseConstant(Arrays.asList(20, 35, 60),
                new double[][]{{0.}, {1.}, {0.}}, 0.5, SyntheticSignals.seededGenerator(17));
        final FittedSegmentCost cost = new L2Cost().fit(signal);
        int previousNumChangepoints = Integer.MAX_VALUE;
        for (final double penalty : new double[]{0.1, 1., 3., 10., 30., 1000.}) {
            final int numChangepoints = PARTITIONER.findOptimalPartition(cost, penalty, 1, 1).getChangepoints().size();
            Assert.assertTrue(numChangepoints <= previousNumChangepoints);
            previousNumChangepoints = numChangepoints;
        }
        Assert.assertEquals(previousNumChangepoints, 0);
    }

    @DataProvider(name = "badPenalties")
    public Object[][] badPenalties() {
        return new Object[][]{{-1.}, {-Double.MIN_VALUE}, {Double.NaN}, {Double.POSITIVE_INFINITY}};
    }

    @Test(dataProvider = "badPenalties", expectedExceptions = UserException.InvalidPenalty.class)
    public void testInvalidPenalty(final double penalty) {
        PARTITIONER.search(new L2Cost().fit(new double[][]{{1.}, {2.}}), penalty, 1, 1);
    }

    @DataProvider(name = "badGrids")
    public Object[][] badGrids() {
        return new Object[][]{{0, 1}, {1, 0}, {-2, 3}, {2, -1}};
    }

    @Test(dataProvider = "badGrids", expectedExceptions = UserException.InvalidGrid.class)
    public void testInvalidGrid(final int jump, final int minSize) {
        PARTITIONER.search(new L2Cost().fit(new double[][]{{1.}, {2.}}), 1., jump, minSize);
    }

    @Test(expectedExceptions = UserException.EmptySignal.class)
    public void testEmptyFittedCost() {
        final FittedSegmentCost empty = new FittedSegmentCost() {
            @Override
            public double error(final int start, final int end) {
                throw new IllegalStateException("no segments in an empty signal");
            }

            @Override
            public int getNumPoints() {
                return 0;
            }

            @Override
            public int getNumDimensions() {
                return 1;
            }

            @Override
            public int getMinimumSegmentLength() {
                return 1;
            }
        };
        PARTITIONER.search(empty, 1., 1, 1);
    }
}

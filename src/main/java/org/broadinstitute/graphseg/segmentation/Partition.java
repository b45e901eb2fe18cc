package org.broadinstitute.graphseg.segmentation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import org.broadinstitute.graphseg.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of a change-point search: the breakpoints of a partition of {@code [0, n)} together with its
 * penalized cost.
 *
 * <p>
 *     Breakpoints are strictly increasing and always end with the number of points {@code n}, so a partition into
 *     {@code k} segments has {@code k} breakpoints and {@code k - 1} changepoints.
 * </p>
 */
public final class Partition {

    private final List<Integer> breakpoints;
    private final double cost;

    /**
     * @param breakpoints strictly increasing, positive breakpoints whose last element is the number of points
     * @param cost sum of segment costs plus the penalty times the number of changepoints
     */
    public Partition(final List<Integer> breakpoints, final double cost) {
        Utils.nonNull(breakpoints, "The breakpoints cannot be null.");
        Utils.validateArg(!breakpoints.isEmpty(), "A partition has at least one breakpoint.");
        Utils.containsNoNull(breakpoints, "The breakpoints cannot contain null.");
        Utils.validateArg(breakpoints.get(0) > 0, "Breakpoints must be positive.");
        for (int i = 1; i < breakpoints.size(); i++) {
            Utils.validateArg(breakpoints.get(i) > breakpoints.get(i - 1), "Breakpoints must be strictly increasing.");
        }
        this.breakpoints = ImmutableList.copyOf(breakpoints);
        this.cost = cost;
    }

    /**
     * @return breakpoints, ending with the number of points
     */
    public List<Integer> getBreakpoints() {
        return breakpoints;
    }

    /**
     * @return breakpoints other than the terminal one, i.e. the indices at which a new segment starts
     */
    public List<Integer> getChangepoints() {
        return breakpoints.subList(0, breakpoints.size() - 1);
    }

    /**
     * @return the segments as closed-open index ranges, in order
     */
    public List<Range<Integer>> getSegments() {
        final List<Range<Integer>> segments = new ArrayList<>(breakpoints.size());
        int start = 0;
        for (final int end : breakpoints) {
            segments.add(Range.closedOpen(start, end));
            start = end;
        }
        return Collections.unmodifiableList(segments);
    }

    public double getCost() {
        return cost;
    }

    public int getNumSegments() {
        return breakpoints.size();
    }

    public int getNumPoints() {
        return breakpoints.get(breakpoints.size() - 1);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Partition that = (Partition) o;
        return Double.compare(that.cost, cost) == 0 && breakpoints.equals(that.breakpoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(breakpoints, cost);
    }

    @Override
    public String toString() {
        return "Partition{" +
                "breakpoints=" + breakpoints +
                ", cost=" + cost +
                '}';
    }
}

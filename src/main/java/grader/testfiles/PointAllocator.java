package grader.testfiles;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves per-case point weights from a test file's total value. Explicit points are kept; whatever budget is left
 * is split evenly across the cases that didn't specify points.
 */
public final class PointAllocator {

    /** slack allowed when comparing sums of doubles */
    public static final double EPSILON = 1e-9;

    private PointAllocator() {}

    /**
     * @param totalValue what the whole test file is worth, must be positive
     * @param cases the test cases, in declared order. Not modified.
     * @param ctx name of the test file, used in error messages
     * @return a new list holding the same cases in the same order, each with non-null points
     * @throws OverallocatedException if explicit points exceed totalValue
     * @throws PointAllocationException if the budget is invalid, or budget remains with no case to absorb it
     */
    public static List<TestCase> resolve(double totalValue, List<TestCase> cases, String ctx)
            throws PointAllocationException {
        if (!(totalValue > 0) || Double.isInfinite(totalValue)) {
            throw new PointAllocationException(ctx, "Total question value must be a positive number, got " + totalValue);
        }

        double totalSpecified = 0;
        int unspecified = 0;
        for (TestCase c : cases) {
            if (null == c.points) {
                unspecified++;
            } else if (c.points < 0 || c.points.isNaN()) {
                throw new PointAllocationException(ctx, "Test case " + c.name + " has invalid point value " + c.points);
            } else {
                totalSpecified += c.points;
            }
        }

        if (totalSpecified > totalValue + EPSILON) {
            throw new OverallocatedException(ctx, totalSpecified, totalValue);
        }

        final double ptsLeft = totalValue - totalSpecified;
        if (0 == unspecified) {
            if (Math.abs(ptsLeft) > EPSILON) {
                throw new PointAllocationException(ctx, String.format(
                        "%s points are left over but every test case specifies its points", ptsLeft));
            }
            return new ArrayList<>(cases);
        }

        final double ptsPerUnspecifiedCase = ptsLeft / unspecified;
        List<TestCase> resolved = new ArrayList<>(cases);
        for (int i = 0; i < resolved.size(); i++) {
            if (null == resolved.get(i).points) {
                resolved.set(i, resolved.get(i).withPoints(ptsPerUnspecifiedCase));
            }
        }
        return resolved;
    }
}

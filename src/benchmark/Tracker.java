package benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Records the performance metrics of an optimisation run, one entry per cost
 * evaluation.
 * <p>
 * The solve count only includes evaluations where the model was actually
 * solved: out of bound candidates, cache hits and final evaluations are
 * recorded but not counted.
 * </p>
 * Not thread safe; owned by a single {@link Benchmarker}.
 */
public class Tracker {

    public static final double IDENTIFIED_TOL = 0.05;

    private final List<Double> costs = new ArrayList<>();
    private final List<Double> paramRMSRE = new ArrayList<>();
    private final List<Integer> paramIdentifiedCount = new ArrayList<>();
    private int solveCount = 0;

    public void update(double[] trueParams, double[] estimatedParams) {
        update(trueParams, estimatedParams, Double.POSITIVE_INFINITY, true);
    }

    public void update(double[] trueParams, double[] estimatedParams, double cost) {
        update(trueParams, estimatedParams, cost, true);
    }

    /**
     * @param trueParams parameters that generated the data
     * @param estimatedParams evaluated parameters, in original space
     * @param cost RMSE cost, +inf if the parameters were out of bounds
     * @param incrementSolveCounter whether the model was solved for this entry
     */
    public void update(double[] trueParams, double[] estimatedParams, double cost, boolean incrementSolveCounter) {
        if (trueParams.length != estimatedParams.length) {
            throw new DimensionMismatchException(estimatedParams.length, trueParams.length);
        }
        double sumSq = 0;
        int identified = 0;
        for (int i = 0; i < trueParams.length; i++) {
            double relErr = (estimatedParams[i] - trueParams[i]) / trueParams[i];
            sumSq += relErr * relErr;
            if (Math.abs(relErr) < IDENTIFIED_TOL) {
                identified++;
            }
        }
        paramRMSRE.add(Math.sqrt(sumSq / trueParams.length));
        paramIdentifiedCount.add(identified);
        costs.add(cost);
        if (incrementSolveCounter) {
            solveCount++;
        }
    }

    public void reset() {
        costs.clear();
        paramRMSRE.clear();
        paramIdentifiedCount.clear();
        solveCount = 0;
    }

    public List<Double> getCosts() {
        return Collections.unmodifiableList(costs);
    }

    public List<Double> getParamRMSRE() {
        return Collections.unmodifiableList(paramRMSRE);
    }

    public List<Integer> getParamIdentifiedCount() {
        return Collections.unmodifiableList(paramIdentifiedCount);
    }

    public int getSolveCount() {
        return solveCount;
    }

    public int size() {
        return costs.size();
    }

    /**
     * @return most recent cost, NaN if nothing has been recorded
     */
    public double lastCost() {
        return costs.isEmpty() ? Double.NaN : costs.get(costs.size() - 1);
    }

    public double bestCost() {
        double best = Double.POSITIVE_INFINITY;
        for (double c : costs) {
            if (c < best) {
                best = c;
            }
        }
        return best;
    }

}

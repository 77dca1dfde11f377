package benchmark;

import java.util.Arrays;
import java.util.HashMap;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transform.ParameterSpace;
import transform.ParameterSpaceTransform;
import transform.ParameterVector;

/**
 * Wraps the simulator, the parameter transform, the bounds checks and the
 * tracker into a single cost function of input space parameter vectors.
 * <p>
 * Each call goes through: transform to original space, bound check, cache
 * lookup or simulation, record in the tracker. Results are memoised on the
 * exact input space vector. Out of bound candidates are never stored as bounds
 * may change between calls. Every call is recorded in the tracker, but only
 * calls that actually solve the model increment the solve count.
 * </p>
 * Not thread safe: each optimisation run needs its own instance.
 */
public class CachedEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(CachedEvaluator.class);

    private final AbstractSimulator simulator;
    private final BoundsChecker boundsChecker;
    private final Tracker tracker;
    private final double[] data;
    private final double[] times;
    private final double[] trueParams;

    private ParameterSpaceTransform transform;

    private final HashMap<ParameterVector, EvaluationEntry> pastResults = new HashMap<>();

    public CachedEvaluator(AbstractSimulator simulator, ParameterSpaceTransform transform,
            BoundsChecker boundsChecker, Tracker tracker,
            double[] data, double[] times, double[] trueParams) {
        if (data.length != times.length) {
            throw new DimensionMismatchException(times.length, data.length);
        }
        if (trueParams.length != transform.getNumParam()) {
            throw new DimensionMismatchException(trueParams.length, transform.getNumParam());
        }
        this.simulator = simulator;
        this.transform = transform;
        this.boundsChecker = boundsChecker;
        this.tracker = tracker;
        this.data = Arrays.copyOf(data, data.length);
        this.times = Arrays.copyOf(times, times.length);
        this.trueParams = Arrays.copyOf(trueParams, trueParams.length);
    }

    public ParameterSpaceTransform getTransform() {
        return transform;
    }

    /**
     * Changing the transform changes what every cached input vector maps to,
     * so the cache is cleared.
     */
    public void setTransform(ParameterSpaceTransform transform) {
        this.transform = transform;
        clearCache();
    }

    public void clearCache() {
        pastResults.clear();
    }

    public int getCacheSize() {
        return pastResults.size();
    }

    public double cost(ParameterVector x) {
        return evaluateEntry(x, true, true).cost;
    }

    public double cost(ParameterVector x, boolean incrementSolveCounter, boolean enforceBounds) {
        return evaluateEntry(x, incrementSolveCounter, enforceBounds).cost;
    }

    /**
     * Evaluate without counting a solve or writing to the cache. Intended for
     * reporting the final parameters of a run.
     */
    public double evaluate(ParameterVector x) {
        return evaluateEntry(x, false, true).cost;
    }

    /**
     * @return model output minus data, +inf everywhere if out of bounds or the
     * model failed to solve
     */
    public double[] signedError(ParameterVector x) {
        double[] r = evaluateEntry(x, true, true).residual;
        return Arrays.copyOf(r, r.length);
    }

    public double[] squaredError(ParameterVector x) {
        double[] r = signedError(x);
        for (int i = 0; i < r.length; i++) {
            r[i] = r[i] * r[i];
        }
        return r;
    }

    private EvaluationEntry evaluateEntry(ParameterVector x, boolean incrementSolveCounter, boolean enforceBounds) {
        x.requireSpace(ParameterSpace.INPUT);
        if (x.length() != transform.getNumParam()) {
            throw new DimensionMismatchException(x.length(), transform.getNumParam());
        }

        ParameterVector original = transform.toOriginal(x);
        double[] p = original.toArray();

        if (!original.isFinite() || (enforceBounds && !boundsChecker.isFeasible(original))) {
            tracker.update(trueParams, p, Double.POSITIVE_INFINITY, false);
            return EvaluationEntry.failed(data.length);
        }

        EvaluationEntry entry = pastResults.get(x);
        if (entry != null) {
            tracker.update(trueParams, p, entry.cost, false);
            return entry;
        }

        entry = simulate(p);
        tracker.update(trueParams, p, entry.cost, incrementSolveCounter);
        if (incrementSolveCounter) {
            pastResults.put(x, entry);
        }
        return entry;
    }

    private EvaluationEntry simulate(double[] p) {
        double[] trace;
        try {
            trace = simulator.simulate(Arrays.copyOf(p, p.length), Arrays.copyOf(times, times.length));
        } catch (SimulationException | RuntimeException ex) {
            LOG.debug("Simulation failed for parameters {}", Arrays.toString(p), ex);
            return EvaluationEntry.failed(data.length);
        }
        if (trace == null || trace.length != data.length) {
            LOG.debug("Simulation returned {} points, expected {}",
                    trace == null ? "no" : Integer.toString(trace.length), data.length);
            return EvaluationEntry.failed(data.length);
        }
        double[] residual = new double[data.length];
        for (int i = 0; i < residual.length; i++) {
            residual[i] = trace[i] - data[i];
            if (!Double.isFinite(residual[i])) {
                LOG.debug("Simulation returned non-finite output at t = {}", times[i]);
                return EvaluationEntry.failed(data.length);
            }
        }
        return new EvaluationEntry(residual, rmse(trace, data));
    }

    /**
     * Root mean squared error between two vectors of the same length.
     */
    public static double rmse(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double sumSq = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / a.length);
    }

    private static final class EvaluationEntry {

        final double[] residual;
        final double cost;

        EvaluationEntry(double[] residual, double cost) {
            this.residual = residual;
            this.cost = cost;
        }

        static EvaluationEntry failed(int length) {
            double[] r = new double[length];
            Arrays.fill(r, Double.POSITIVE_INFINITY);
            return new EvaluationEntry(r, Double.POSITIVE_INFINITY);
        }
    }

}

package benchmark;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transform.ParameterSpace;
import transform.ParameterSpaceTransform;
import transform.ParameterTransform;
import transform.ParameterTransformLog;
import transform.ParameterVector;
import transform.TransformConfig;

/**
 * Evaluation engine shared by every optimiser under benchmark.
 * <p>
 * Owns the default parameters, bounds, transform configuration and convergence
 * threshold of a problem, and exposes the contract optimisers call into:
 * {@link #sample()}, {@link #cost(ParameterVector)},
 * {@link #grad(ParameterVector, double, boolean)}, {@link #isConverged()} and
 * {@link #evaluate(ParameterVector)}. Optimisers only ever see input space
 * vectors.
 * </p>
 * <p>
 * {@code cost} never throws for out of bound candidates or failed simulations,
 * both give +inf. Wrong vector lengths and invalid configuration are thrown.
 * </p>
 * Not thread safe: parallel runs need one instance each.
 */
public class Benchmarker {

    private static final Logger LOG = LoggerFactory.getLogger(Benchmarker.class);

    public static final double GRAD_STEP = 1e-5;
    public static final int GRAD_MAX_STEP_HALVING = 10;

    private final String name;
    private final double[] defaultParams;
    private TransformConfig transformConfig;
    private final BoundsChecker boundsChecker;
    private final Tracker tracker;
    private final CachedEvaluator evaluator;
    private final RandomGenerator rng;

    private ParameterSpaceTransform transform;
    private double costThreshold;

    public Benchmarker(BenchmarkerConfig config, AbstractSimulator simulator) {
        this(config, simulator, new MersenneTwister(config.getSeed()));
    }

    public Benchmarker(BenchmarkerConfig config, AbstractSimulator simulator, RandomGenerator rng) {
        config.validate();
        this.name = config.getName();
        LOG.info("Initialising {} benchmark", name);

        this.defaultParams = config.getDefaultParams();
        this.transformConfig = config.getTransformConfig();
        this.transform = buildTransform(transformConfig);
        this.costThreshold = config.getCostThreshold();
        this.rng = rng;

        this.boundsChecker = new BoundsChecker(defaultParams.length);
        boundsChecker.setBounds(config.getBounds());
        boundsChecker.setRateBound(config.getRateBound());

        this.tracker = new Tracker();
        this.evaluator = new CachedEvaluator(simulator, transform, boundsChecker, tracker,
                config.getData(), config.getTimes(), config.getTrueParams());

        LOG.info("Benchmarker initialised with {} parameters", defaultParams.length);
    }

    private ParameterSpaceTransform buildTransform(TransformConfig config) {
        ParameterSpaceTransform t = new ParameterSpaceTransform(defaultParams, config);
        // Fails fast if a log transformed default parameter is not positive
        t.toInput(defaultParams);
        return t;
    }

    /**
     * The current configuration is kept if the new one is invalid.
     */
    private void rebuildTransform(TransformConfig config) {
        transform = buildTransform(config);
        transformConfig = config;
        evaluator.setTransform(transform);
    }

    public String getName() {
        return name;
    }

    public int nParameters() {
        return defaultParams.length;
    }

    public double[] getDefaultParams() {
        return Arrays.copyOf(defaultParams, defaultParams.length);
    }

    public Tracker getTracker() {
        return tracker;
    }

    public BoundsChecker getBoundsChecker() {
        return boundsChecker;
    }

    public RandomGenerator getRandomGenerator() {
        return rng;
    }

    public double getCostThreshold() {
        return costThreshold;
    }

    public void setCostThreshold(double costThreshold) {
        this.costThreshold = costThreshold;
    }

    // <editor-fold defaultstate="collapsed" desc="Parameter space">
    public ParameterSpaceTransform getTransform() {
        return transform;
    }

    public TransformConfig getTransformConfig() {
        return new TransformConfig(transformConfig);
    }

    public void setUseScaleFactors(boolean useScaleFactors) {
        TransformConfig config = new TransformConfig(transformConfig);
        config.setUseScaleFactor(useScaleFactors);
        rebuildTransform(config);
    }

    /**
     * Fit the flagged parameters in log space. Clears the cost cache.
     */
    public void logTransform(boolean[] whichParams) {
        if (whichParams.length != defaultParams.length) {
            throw new DimensionMismatchException(whichParams.length, defaultParams.length);
        }
        TransformConfig config = new TransformConfig(transformConfig);
        config.setLogTransform(whichParams);
        rebuildTransform(config);
    }

    public void logTransformAll() {
        boolean[] all = new boolean[defaultParams.length];
        Arrays.fill(all, true);
        logTransform(all);
    }

    public ParameterVector inputParameterSpace(ParameterVector original) {
        return transform.toInput(original);
    }

    public ParameterVector originalParameterSpace(ParameterVector input) {
        return transform.toOriginal(input);
    }
    // </editor-fold>

    // <editor-fold defaultstate="collapsed" desc="Bounds">
    /**
     * Bounds given in input space are mapped to original space once, here.
     */
    public void addBounds(double[] lb, double[] ub, ParameterSpace space) {
        double[] lo = Arrays.copyOf(lb, lb.length);
        double[] hi = Arrays.copyOf(ub, ub.length);
        if (space == ParameterSpace.INPUT) {
            double[] a = transform.toOriginal(lo);
            double[] b = transform.toOriginal(hi);
            for (int i = 0; i < a.length; i++) {
                lo[i] = Math.min(a[i], b[i]);
                hi[i] = Math.max(a[i], b[i]);
            }
        }
        boundsChecker.setBounds(new Bounds(lo, hi));
    }

    public void setBounded(boolean bounded) {
        boundsChecker.setBounded(bounded);
    }

    public boolean isBounded() {
        return boundsChecker.isBounded();
    }

    public void setRateBound(RateBound rateBound) {
        boundsChecker.setRateBound(rateBound);
    }

    public boolean inBounds(ParameterVector original) {
        return boundsChecker.inBounds(original);
    }

    public boolean inRateBounds(ParameterVector original) {
        return boundsChecker.inRateBounds(original);
    }

    /**
     * @param x input space vector
     */
    public boolean isFeasible(ParameterVector x) {
        ParameterVector original = transform.toOriginal(x);
        return original.isFinite() && boundsChecker.isFeasible(original);
    }

    /**
     * The parameter bounds mapped to input space, as {lb, ub}. Unbounded
     * parameters get infinite bounds.
     */
    public double[][] getInputBounds() {
        int n = nParameters();
        double[][] res = new double[2][n];
        for (int i = 0; i < n; i++) {
            double lo = Double.NEGATIVE_INFINITY;
            double hi = Double.POSITIVE_INFINITY;
            if (boundsChecker.isBounded()) {
                lo = boundsChecker.getBounds().getLower(i);
                hi = boundsChecker.getBounds().getUpper(i);
            }
            double a = toInputBound(i, lo);
            double b = toInputBound(i, hi);
            res[Bounds.LIMIT_L][i] = Math.min(a, b);
            res[Bounds.LIMIT_U][i] = Math.max(a, b);
        }
        return res;
    }

    private double toInputBound(int i, double bound) {
        ParameterTransform t = transform.getTransform(i);
        if (t instanceof ParameterTransformLog && !(bound / t.getScale() > 0)) {
            return Double.NEGATIVE_INFINITY;
        }
        return t.toInput(bound);
    }

    /**
     * Hard clip of an input space vector to the bounds, axis by axis.
     */
    public ParameterVector clampParameters(ParameterVector x) {
        x.requireSpace(ParameterSpace.INPUT);
        double[] p = x.toArray();
        if (p.length != nParameters()) {
            throw new DimensionMismatchException(p.length, nParameters());
        }
        double[][] inputBounds = getInputBounds();
        for (int i = 0; i < p.length; i++) {
            p[i] = Math.min(Math.max(p[i], inputBounds[Bounds.LIMIT_L][i]), inputBounds[Bounds.LIMIT_U][i]);
        }
        return new ParameterVector(p, ParameterSpace.INPUT);
    }
    // </editor-fold>

    /**
     * Draws an input space parameter vector. Parameters with finite bounds are
     * drawn uniformly within them, others are the default perturbed by a
     * uniform factor in [0.5, 1.5] and then clipped to the bounds in input
     * space. A log transformed parameter whose lower bound is not positive
     * counts as unbounded below.
     */
    public ParameterVector sample() {
        double[] x = new double[nParameters()];
        double[][] inputBounds = getInputBounds();
        Bounds bounds = boundsChecker.getBounds();
        for (int i = 0; i < x.length; i++) {
            double lo = inputBounds[Bounds.LIMIT_L][i];
            double hi = inputBounds[Bounds.LIMIT_U][i];
            ParameterTransform t = transform.getTransform(i);
            if (boundsChecker.isBounded() && bounds.isFinite(i) && Double.isFinite(lo) && Double.isFinite(hi)) {
                double p = bounds.getLower(i) + rng.nextDouble() * (bounds.getUpper(i) - bounds.getLower(i));
                x[i] = t.toInput(p);
            } else {
                x[i] = t.toInput(defaultParams[i] * (0.5 + rng.nextDouble()));
            }
            x[i] = Math.min(Math.max(x[i], lo), hi);
        }
        return new ParameterVector(x, ParameterSpace.INPUT);
    }

    public List<ParameterVector> sample(int n) {
        List<ParameterVector> res = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            res.add(sample());
        }
        return res;
    }

    // <editor-fold defaultstate="collapsed" desc="Cost">
    public double cost(ParameterVector x) {
        return evaluator.cost(x);
    }

    public double[] signedError(ParameterVector x) {
        return evaluator.signedError(x);
    }

    public double[] squaredError(ParameterVector x) {
        return evaluator.squaredError(x);
    }

    public static double rmse(double[] a, double[] b) {
        return CachedEvaluator.rmse(a, b);
    }

    public double[] grad(ParameterVector x) {
        return grad(x, Double.NaN, true);
    }

    public double[] grad(ParameterVector x, double centreCost) {
        return grad(x, centreCost, true);
    }

    /**
     * Forward difference gradient of the cost in input space.
     * <p>
     * If the centre is in bounds, each step is taken in whichever direction
     * stays in bounds, halving the step if neither does. If no step in bounds
     * is found the smallest step is taken ignoring bounds. If the centre itself
     * is out of bounds, bounds are ignored throughout.
     * </p>
     *
     * @param centreCost cost at x if already known, NaN otherwise
     * @param incrementSolveCounter if false, no solve is counted and nothing is
     * cached
     */
    public double[] grad(ParameterVector x, double centreCost, boolean incrementSolveCounter) {
        x.requireSpace(ParameterSpace.INPUT);
        double[] x0 = x.toArray();
        int n = nParameters();
        if (x0.length != n) {
            throw new DimensionMismatchException(x0.length, n);
        }

        boolean centreFeasible = isFeasible(x);
        if (!centreFeasible && LOG.isDebugEnabled()) {
            LOG.debug("Gradient centre {} out of bounds, bounds ignored", x);
        }

        double f0 = centreCost;
        if (Double.isNaN(f0)) {
            f0 = evaluator.cost(x, incrementSolveCounter, centreFeasible);
        }

        double[] g = new double[n];
        for (int i = 0; i < n; i++) {
            double h = GRAD_STEP * Math.max(Math.abs(x0[i]), 1);
            double step = h;
            boolean enforceBounds = centreFeasible;

            if (centreFeasible) {
                boolean found = false;
                for (int k = 0; k <= GRAD_MAX_STEP_HALVING && !found; k++) {
                    if (isFeasible(shift(x0, i, h))) {
                        step = h;
                        found = true;
                    } else if (isFeasible(shift(x0, i, -h))) {
                        step = -h;
                        found = true;
                    } else {
                        step = h;
                        h = h / 2;
                    }
                }
                if (!found) {
                    LOG.warn("No step in bounds found for parameter #{}, bounds ignored with step {}", i, step);
                    enforceBounds = false;
                }
            }

            double f1 = evaluator.cost(shift(x0, i, step), incrementSolveCounter, enforceBounds);
            g[i] = (f1 - f0) / step;
        }
        return g;
    }

    private static ParameterVector shift(double[] x0, int index, double step) {
        double[] x1 = Arrays.copyOf(x0, x0.length);
        x1[index] = x1[index] + step;
        return new ParameterVector(x1, ParameterSpace.INPUT);
    }
    // </editor-fold>

    /**
     * @return true if the most recently recorded cost is below the threshold
     */
    public boolean isConverged() {
        return tracker.lastCost() < costThreshold;
    }

    /**
     * Clears the tracker and the cost cache.
     */
    public void reset() {
        tracker.reset();
        evaluator.clearCache();
    }

    /**
     * Reports the performance of the final parameters of a run. Does not
     * increase the number of cost evaluations.
     */
    public EvaluationReport evaluate(ParameterVector x) {
        LOG.info("Evaluating final parameters for {}", name);
        int solveCount = tracker.getSolveCount();
        double finalCost = evaluator.evaluate(x);
        int last = tracker.size() - 1;
        EvaluationReport report = new EvaluationReport(solveCount, finalCost, tracker.bestCost(),
                tracker.getParamRMSRE().get(last), tracker.getParamIdentifiedCount().get(last), nParameters());
        LOG.info("Benchmark complete\n{}", report);
        return report;
    }

}

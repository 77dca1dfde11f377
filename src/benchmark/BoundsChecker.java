package benchmark;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transform.ParameterSpace;
import transform.ParameterVector;

/**
 * Checks original space parameter vectors against absolute bounds and against
 * rate bounds. Both checks are pure: the answer only depends on the vector and
 * on the bounds configured at the time of the call.
 */
public class BoundsChecker {

    private static final Logger LOG = LoggerFactory.getLogger(BoundsChecker.class);

    private final int numParam;
    private Bounds bounds = null;
    private boolean bounded = false;
    private RateBound rateBound = null;
    private boolean ratesBounded = false;

    public BoundsChecker(int numParam) {
        this.numParam = numParam;
    }

    public Bounds getBounds() {
        return bounds;
    }

    public void setBounds(Bounds bounds) {
        if (bounds != null && bounds.length() != numParam) {
            throw new DimensionMismatchException(bounds.length(), numParam);
        }
        this.bounds = bounds;
        this.bounded = bounds != null;
    }

    /**
     * Parameter bounds are only enforced if they are defined and bounding is on.
     */
    public boolean isBounded() {
        return bounded && bounds != null;
    }

    public void setBounded(boolean bounded) {
        this.bounded = bounded;
    }

    public RateBound getRateBound() {
        return rateBound;
    }

    public void setRateBound(RateBound rateBound) {
        this.rateBound = rateBound;
        this.ratesBounded = rateBound != null;
    }

    public boolean isRatesBounded() {
        return ratesBounded && rateBound != null && !rateBound.getRateFunctions().isEmpty();
    }

    public void setRatesBounded(boolean ratesBounded) {
        this.ratesBounded = ratesBounded;
    }

    public boolean inBounds(ParameterVector original) {
        double[] p = checkVector(original);
        if (isBounded()) {
            for (int i = 0; i < p.length; i++) {
                // Written so NaN fails
                if (!(bounds.getLower(i) <= p[i] && p[i] <= bounds.getUpper(i))) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean inRateBounds(ParameterVector original) {
        double[] p = checkVector(original);
        if (isRatesBounded()) {
            double[] voltages = rateBound.getVoltages();
            for (RateFunction rateFunc : rateBound.getRateFunctions()) {
                for (double v : voltages) {
                    double r = rateFunc.rate(p, v);
                    if (!(rateBound.getRateMin() <= r && r <= rateBound.getRateMax())) {
                        if (LOG.isDebugEnabled()) {
                            LOG.debug("{} rate {} at V = {} outside [{}, {}]", rateFunc.getPolarity(), r, v,
                                    rateBound.getRateMin(), rateBound.getRateMax());
                        }
                        return false;
                    }
                }
            }
        }
        return true;
    }

    public boolean isFeasible(ParameterVector original) {
        return inBounds(original) && inRateBounds(original);
    }

    /**
     * Hard clip of each entry to [lb, ub]. Returns the vector unchanged if no
     * parameter bounds are in force.
     */
    public ParameterVector clamp(ParameterVector original) {
        double[] p = checkVector(original);
        if (isBounded()) {
            for (int i = 0; i < p.length; i++) {
                p[i] = Math.min(Math.max(p[i], bounds.getLower(i)), bounds.getUpper(i));
            }
        }
        return new ParameterVector(p, ParameterSpace.ORIGINAL);
    }

    private double[] checkVector(ParameterVector original) {
        original.requireSpace(ParameterSpace.ORIGINAL);
        if (original.length() != numParam) {
            throw new DimensionMismatchException(original.length(), numParam);
        }
        return original.toArray();
    }

}

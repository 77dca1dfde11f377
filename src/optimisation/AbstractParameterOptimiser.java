package optimisation;

import benchmark.Benchmarker;
import benchmark.EvaluationReport;
import transform.ParameterSpace;
import transform.ParameterVector;

/**
 * An abstract version of a parameter optimiser run against a benchmarker
 *
 * @author Ben Hui
 * @version 20140219
 *
 */
public abstract class AbstractParameterOptimiser {

    protected final Benchmarker bm;

    protected ParameterVector X0 = null; // Input space, null to sample starting points
    protected ParameterVector bestX = null;
    protected double baseCost = Double.POSITIVE_INFINITY;
    protected EvaluationReport report = null;

    protected boolean optStopped = false;

    public AbstractParameterOptimiser(Benchmarker bm) {
        this.bm = bm;
    }

    public boolean isOptStopped() {
        return optStopped;
    }

    public void setOptStopped(boolean optStopped) {
        this.optStopped = optStopped;
    }

    protected abstract void handleResults();

    /**
     * Runs the optimisation and evaluates the best parameters found.
     *
     * @return best input space parameters
     */
    public abstract ParameterVector optimise();

    public abstract void initialise();

    public Benchmarker getBenchmarker() {
        return bm;
    }

    public ParameterVector getX0() {
        return X0;
    }

    public void setX0(ParameterVector X0) {
        this.X0 = X0 == null ? null : X0.requireSpace(ParameterSpace.INPUT);
    }

    /**
     * Set the starting point from original space parameters
     */
    public void setP0(ParameterVector p0) {
        this.X0 = bm.inputParameterSpace(p0);
    }

    public ParameterVector getBestX() {
        return bestX;
    }

    public double getBaseCost() {
        return baseCost;
    }

    public EvaluationReport getReport() {
        return report;
    }

    // General method for getting and setting parameter
    public Object getParameter(int paramId) {
        return null;
    }

    public Object setParameter(int paramId, Object newParm) {
        return null;
    }

}

package benchmark;

/**
 * An abstract function to define the simulator a benchmark problem is fitted
 * against. Parameters are always given in the original parameter space.
 *
 * @author Ben Hui
 */
public abstract class AbstractSimulator {

    /**
     * @param param parameter vector in original space
     * @param times time points at which the output is recorded
     * @return model output at each time point
     * @throws SimulationException if the model could not be solved
     */
    public abstract double[] simulate(double[] param, double[] times) throws SimulationException;

}

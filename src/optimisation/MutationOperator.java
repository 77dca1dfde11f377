package optimisation;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Perturbation of a single input space vector. Implementations return a new
 * array and leave the argument untouched.
 */
public abstract class MutationOperator {

    public abstract double[] mutate(double[] x, double[] lb, double[] ub, RandomGenerator rng);

}

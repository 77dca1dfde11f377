package optimisation;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Pairwise recombination of two input space parent vectors into two offspring,
 * bounded to [lb, ub] (entries may be infinite).
 */
public abstract class CrossoverOperator {

    public abstract double[][] crossover(double[] parentA, double[] parentB,
            double[] lb, double[] ub, RandomGenerator rng);

    protected static double clip(double v, double lo, double hi) {
        return Math.min(Math.max(v, lo), hi);
    }

}

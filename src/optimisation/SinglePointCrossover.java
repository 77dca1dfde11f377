package optimisation;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Swaps the tails of the two parents after a random cut point.
 */
public class SinglePointCrossover extends CrossoverOperator {

    @Override
    public double[][] crossover(double[] parentA, double[] parentB,
            double[] lb, double[] ub, RandomGenerator rng) {
        int n = parentA.length;
        // Cut in [1, n-1] so both parents contribute, when n > 1
        int cut = n > 1 ? 1 + rng.nextInt(n - 1) : n;

        double[] c1 = new double[n];
        double[] c2 = new double[n];
        for (int i = 0; i < n; i++) {
            if (i < cut) {
                c1[i] = clip(parentA[i], lb[i], ub[i]);
                c2[i] = clip(parentB[i], lb[i], ub[i]);
            } else {
                c1[i] = clip(parentB[i], lb[i], ub[i]);
                c2[i] = clip(parentA[i], lb[i], ub[i]);
            }
        }
        return new double[][]{c1, c2};
    }

}

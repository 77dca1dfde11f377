package optimisation;

import java.util.Arrays;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Simulated binary crossover (SBX) with bounded spread.
 *
 * See:
 * <pre>
 * Deb K, Agrawal RB.
 * Simulated binary crossover for continuous search space.
 * Complex Systems. 1995;9(2):115-48.
 * </pre>
 *
 * With infinite bounds the spread factor reduces to the unbounded form.
 */
public class SimulatedBinaryCrossover extends CrossoverOperator {

    public static final double DEFAULT_PROB = 0.9;
    public static final double DEFAULT_PROB_VAR = 0.5;
    private static final double EPS = 1e-14;

    private final double eta;
    private final double prob;
    private final double probVar;

    public SimulatedBinaryCrossover(double eta) {
        this(eta, DEFAULT_PROB, DEFAULT_PROB_VAR);
    }

    public SimulatedBinaryCrossover(double eta, double prob, double probVar) {
        this.eta = eta;
        this.prob = prob;
        this.probVar = probVar;
    }

    @Override
    public double[][] crossover(double[] parentA, double[] parentB,
            double[] lb, double[] ub, RandomGenerator rng) {
        double[] c1 = Arrays.copyOf(parentA, parentA.length);
        double[] c2 = Arrays.copyOf(parentB, parentB.length);

        if (rng.nextDouble() < prob) {
            for (int i = 0; i < c1.length; i++) {
                if (rng.nextDouble() >= probVar || Math.abs(parentA[i] - parentB[i]) <= EPS) {
                    continue;
                }
                double y1 = Math.min(parentA[i], parentB[i]);
                double y2 = Math.max(parentA[i], parentB[i]);
                double diff = y2 - y1;
                double u = rng.nextDouble();

                double beta = 1 + 2 * (y1 - lb[i]) / diff;
                double v1 = 0.5 * (y1 + y2 - spread(beta, u) * diff);

                beta = 1 + 2 * (ub[i] - y2) / diff;
                double v2 = 0.5 * (y1 + y2 + spread(beta, u) * diff);

                v1 = clip(v1, lb[i], ub[i]);
                v2 = clip(v2, lb[i], ub[i]);

                if (rng.nextDouble() < 0.5) {
                    c1[i] = v2;
                    c2[i] = v1;
                } else {
                    c1[i] = v1;
                    c2[i] = v2;
                }
            }
        }
        return new double[][]{c1, c2};
    }

    private double spread(double beta, double u) {
        // Parents outside the bounds give beta < 1
        beta = Math.max(beta, 1);
        double alpha = 2 - Math.pow(beta, -(eta + 1));
        if (u <= 1 / alpha) {
            return Math.pow(u * alpha, 1 / (eta + 1));
        } else {
            return Math.pow(1 / (2 - u * alpha), 1 / (eta + 1));
        }
    }

}

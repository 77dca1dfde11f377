package optimisation;

import java.util.Arrays;
import org.apache.commons.math3.distribution.CauchyDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Moves the vector along a random direction by a Cauchy distributed magnitude.
 * Bounds are not applied; out of bound results are rejected later by their
 * infinite cost.
 */
public class CauchyMutation extends MutationOperator {

    public static final double DEFAULT_SCALE = 0.18;
    public static final double DEFAULT_PROB = 0.9;

    private final double scale;
    private final double prob;

    public CauchyMutation() {
        this(DEFAULT_SCALE, DEFAULT_PROB);
    }

    public CauchyMutation(double scale, double prob) {
        this.scale = scale;
        this.prob = prob;
    }

    @Override
    public double[] mutate(double[] x, double[] lb, double[] ub, RandomGenerator rng) {
        double[] res = Arrays.copyOf(x, x.length);
        if (rng.nextDouble() < prob) {
            double[] direc = new double[x.length];
            double norm = 0;
            for (int i = 0; i < direc.length; i++) {
                direc[i] = rng.nextDouble();
                norm += direc[i] * direc[i];
            }
            norm = Math.sqrt(norm);
            if (norm == 0) {
                return res;
            }
            double mag = new CauchyDistribution(rng, 0, scale).sample();
            for (int i = 0; i < res.length; i++) {
                res[i] += mag * direc[i] / norm;
            }
        }
        return res;
    }

}

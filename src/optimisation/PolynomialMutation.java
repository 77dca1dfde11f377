package optimisation;

import java.util.Arrays;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Polynomial mutation of Deb and Goyal. Each parameter is mutated with
 * probability probVar; parameters without finite bounds are left unchanged.
 */
public class PolynomialMutation extends MutationOperator {

    private final double eta;
    private final double probVar;

    public PolynomialMutation(double eta, double probVar) {
        this.eta = eta;
        this.probVar = probVar;
    }

    @Override
    public double[] mutate(double[] x, double[] lb, double[] ub, RandomGenerator rng) {
        double[] res = Arrays.copyOf(x, x.length);
        double mutPow = 1 / (eta + 1);
        for (int i = 0; i < res.length; i++) {
            double range = ub[i] - lb[i];
            if (rng.nextDouble() >= probVar || !Double.isFinite(range) || range <= 0) {
                continue;
            }
            double delta1 = (res[i] - lb[i]) / range;
            double delta2 = (ub[i] - res[i]) / range;
            double u = rng.nextDouble();
            double deltaq;
            if (u <= 0.5) {
                double xy = 1 - delta1;
                double val = 2 * u + (1 - 2 * u) * Math.pow(xy, eta + 1);
                deltaq = Math.pow(val, mutPow) - 1;
            } else {
                double xy = 1 - delta2;
                double val = 2 * (1 - u) + 2 * (u - 0.5) * Math.pow(xy, eta + 1);
                deltaq = 1 - Math.pow(val, mutPow);
            }
            res[i] = Math.min(Math.max(res[i] + deltaq * range, lb[i]), ub[i]);
        }
        return res;
    }

}

package optimisation;

import java.util.Arrays;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class Test_Operators {

    private static final double INF = Double.POSITIVE_INFINITY;

    @Test
    public void sbxWithinBounds() {
        RandomGenerator rng = new MersenneTwister(1);
        SimulatedBinaryCrossover sbx = new SimulatedBinaryCrossover(2, 1, 1);
        double[] lb = {0, -1};
        double[] ub = {1, 1};
        for (int rep = 0; rep < 500; rep++) {
            double[][] c = sbx.crossover(new double[]{0.1, -0.9}, new double[]{0.95, 0.8}, lb, ub, rng);
            for (double[] child : c) {
                for (int i = 0; i < child.length; i++) {
                    assertTrue(child[i] >= lb[i] && child[i] <= ub[i]);
                }
            }
        }
    }

    @Test
    public void sbxWithInfiniteBounds() {
        RandomGenerator rng = new MersenneTwister(2);
        SimulatedBinaryCrossover sbx = new SimulatedBinaryCrossover(10, 1, 1);
        double[] lb = {-INF, -INF};
        double[] ub = {INF, INF};
        for (int rep = 0; rep < 500; rep++) {
            double[][] c = sbx.crossover(new double[]{0, 5}, new double[]{1, -5}, lb, ub, rng);
            for (double[] child : c) {
                for (double v : child) {
                    assertTrue(Double.isFinite(v));
                }
            }
            // Spread is symmetric about the parents' mean
            assertEquals(1.0, c[0][0] + c[1][0], 1e-12);
            assertEquals(0.0, c[0][1] + c[1][1], 1e-12);
        }
    }

    @Test
    public void sbxWithParentOutOfBounds() {
        RandomGenerator rng = new MersenneTwister(6);
        SimulatedBinaryCrossover sbx = new SimulatedBinaryCrossover(2.5, 1, 1);
        for (int rep = 0; rep < 200; rep++) {
            double[][] c = sbx.crossover(new double[]{-2.0}, new double[]{0.5}, new double[]{0}, new double[]{1}, rng);
            for (double[] child : c) {
                assertTrue(child[0] >= 0 && child[0] <= 1, "child = " + child[0]);
            }
        }
    }

    @Test
    public void sbxOnIdenticalParents() {
        double[][] c = new SimulatedBinaryCrossover(10, 1, 1).crossover(new double[]{0.5, 0.5},
                new double[]{0.5, 0.5}, new double[]{0, 0}, new double[]{1, 1}, new MersenneTwister(3));
        assertArrayEquals(new double[]{0.5, 0.5}, c[0]);
        assertArrayEquals(new double[]{0.5, 0.5}, c[1]);
    }

    @Test
    public void cauchyMutationMovesAlongADirection() {
        RandomGenerator rng = new MersenneTwister(4);
        CauchyMutation mutation = new CauchyMutation(0.18, 1);
        double[] x = {1, 2, 3};
        double[] y = mutation.mutate(x, new double[]{0, 0, 0}, new double[]{5, 5, 5}, rng);
        assertArrayEquals(new double[]{1, 2, 3}, x);
        assertFalse(Arrays.equals(x, y));
        for (int i = 0; i < x.length; i++) {
            // Same sign of move on every axis
            assertEquals(Math.signum(y[0] - x[0]), Math.signum(y[i] - x[i]));
        }
    }

    @Test
    public void polynomialMutationSkipsUnboundedAxes() {
        RandomGenerator rng = new MersenneTwister(5);
        PolynomialMutation mutation = new PolynomialMutation(20, 1);
        for (int rep = 0; rep < 200; rep++) {
            double[] y = mutation.mutate(new double[]{0.5, 7}, new double[]{0, -INF}, new double[]{1, INF}, rng);
            assertTrue(y[0] >= 0 && y[0] <= 1);
            assertEquals(7.0, y[1]);
        }
    }

}

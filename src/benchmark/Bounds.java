package benchmark;

import java.util.Arrays;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;

/**
 * Lower and upper parameter bounds in original space. Infinite entries mean
 * that side is unbounded.
 */
public class Bounds {

    public static final int LIMIT_L = 0;
    public static final int LIMIT_U = 1;

    private final double[] lb;
    private final double[] ub;

    public Bounds(double[] lb, double[] ub) {
        if (lb.length != ub.length) {
            throw new DimensionMismatchException(ub.length, lb.length);
        }
        for (int i = 0; i < lb.length; i++) {
            if (Double.isNaN(lb[i]) || Double.isNaN(ub[i])) {
                throw new IllegalArgumentException("Bound on parameter #" + i + " is NaN");
            }
            if (ub[i] < lb[i]) {
                throw new NumberIsTooSmallException(ub[i], lb[i], true);
            }
        }
        this.lb = Arrays.copyOf(lb, lb.length);
        this.ub = Arrays.copyOf(ub, ub.length);
    }

    public int length() {
        return lb.length;
    }

    public double getLower(int i) {
        return lb[i];
    }

    public double getUpper(int i) {
        return ub[i];
    }

    public double[] getLower() {
        return Arrays.copyOf(lb, lb.length);
    }

    public double[] getUpper() {
        return Arrays.copyOf(ub, ub.length);
    }

    public boolean isFinite(int i) {
        return Double.isFinite(lb[i]) && Double.isFinite(ub[i]);
    }

    @Override
    public String toString() {
        return "[" + Arrays.toString(lb) + ", " + Arrays.toString(ub) + "]";
    }

}

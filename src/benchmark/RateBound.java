package benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.exception.NumberIsTooLargeException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;

/**
 * Derived feasibility constraint: every rate function must stay within
 * [rateMin, rateMax] at every voltage of an evenly spaced grid on [vLow, vHigh].
 */
public class RateBound {

    public static final double DEFAULT_RATE_MIN = 1.67e-5;
    public static final double DEFAULT_RATE_MAX = 1e3;
    public static final int DEFAULT_NUM_VOLTAGES = 2;

    private final List<RateFunction> rateFunctions;
    private final double rateMin;
    private final double rateMax;
    private final double[] voltages;

    public RateBound(List<RateFunction> rateFunctions, double vLow, double vHigh) {
        this(rateFunctions, DEFAULT_RATE_MIN, DEFAULT_RATE_MAX, vLow, vHigh, DEFAULT_NUM_VOLTAGES);
    }

    public RateBound(List<RateFunction> rateFunctions, double rateMin, double rateMax,
            double vLow, double vHigh, int numVoltages) {
        if (rateMin > rateMax) {
            throw new NumberIsTooLargeException(rateMin, rateMax, true);
        }
        if (vLow > vHigh) {
            throw new NumberIsTooLargeException(vLow, vHigh, true);
        }
        if (numVoltages < 2) {
            throw new NumberIsTooSmallException(numVoltages, 2, true);
        }
        this.rateFunctions = Collections.unmodifiableList(new ArrayList<>(rateFunctions));
        this.rateMin = rateMin;
        this.rateMax = rateMax;
        this.voltages = new double[numVoltages];
        double dv = (vHigh - vLow) / (numVoltages - 1);
        for (int i = 0; i < numVoltages; i++) {
            voltages[i] = vLow + i * dv;
        }
        // Endpoint exact
        voltages[numVoltages - 1] = vHigh;
    }

    public List<RateFunction> getRateFunctions() {
        return rateFunctions;
    }

    public double getRateMin() {
        return rateMin;
    }

    public double getRateMax() {
        return rateMax;
    }

    public double[] getVoltages() {
        return voltages.clone();
    }

}

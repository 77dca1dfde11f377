package benchmark;

import java.util.Arrays;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NotFiniteNumberException;
import transform.TransformConfig;

/**
 * Everything that defines a benchmark problem apart from the simulator itself.
 * Problem families share settings by sharing (or copying) a configuration
 * rather than by subclassing the benchmarker.
 */
public class BenchmarkerConfig {

    public static final double DEFAULT_COST_THRESHOLD = 0.01;
    public static final long DEFAULT_SEED = 2251912970037127827L;

    private String name = "benchmark";
    private double[] defaultParams;
    private double[] trueParams = null; // null means the default parameters
    private double[] data;
    private double[] times;
    private TransformConfig transformConfig = null;
    private Bounds bounds = null;
    private RateBound rateBound = null;
    private double costThreshold = DEFAULT_COST_THRESHOLD;
    private long seed = DEFAULT_SEED;

    public BenchmarkerConfig(double[] defaultParams, double[] data, double[] times) {
        this.defaultParams = Arrays.copyOf(defaultParams, defaultParams.length);
        this.data = Arrays.copyOf(data, data.length);
        this.times = Arrays.copyOf(times, times.length);
    }

    /**
     * @throws org.apache.commons.math3.exception.MathIllegalArgumentException if
     * any of the vector lengths disagree, there is no data or the data is not
     * finite
     */
    public void validate() {
        int n = defaultParams.length;
        if (n == 0) {
            throw new NoDataException();
        }
        if (data.length == 0) {
            throw new NoDataException();
        }
        if (data.length != times.length) {
            throw new DimensionMismatchException(times.length, data.length);
        }
        for (int i = 0; i < data.length; i++) {
            if (!Double.isFinite(data[i])) {
                throw new NotFiniteNumberException(data[i]);
            }
            if (!Double.isFinite(times[i])) {
                throw new NotFiniteNumberException(times[i]);
            }
        }
        if (trueParams != null && trueParams.length != n) {
            throw new DimensionMismatchException(trueParams.length, n);
        }
        if (transformConfig != null && transformConfig.getNumParam() != n) {
            throw new DimensionMismatchException(transformConfig.getNumParam(), n);
        }
        if (bounds != null && bounds.length() != n) {
            throw new DimensionMismatchException(bounds.length(), n);
        }
        if (Double.isNaN(costThreshold)) {
            throw new IllegalArgumentException("Cost threshold is NaN");
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double[] getDefaultParams() {
        return Arrays.copyOf(defaultParams, defaultParams.length);
    }

    public void setDefaultParams(double[] defaultParams) {
        this.defaultParams = Arrays.copyOf(defaultParams, defaultParams.length);
    }

    public double[] getTrueParams() {
        return trueParams == null ? getDefaultParams() : Arrays.copyOf(trueParams, trueParams.length);
    }

    public void setTrueParams(double[] trueParams) {
        this.trueParams = trueParams == null ? null : Arrays.copyOf(trueParams, trueParams.length);
    }

    public double[] getData() {
        return Arrays.copyOf(data, data.length);
    }

    public void setData(double[] data) {
        this.data = Arrays.copyOf(data, data.length);
    }

    public double[] getTimes() {
        return Arrays.copyOf(times, times.length);
    }

    public void setTimes(double[] times) {
        this.times = Arrays.copyOf(times, times.length);
    }

    public TransformConfig getTransformConfig() {
        return transformConfig == null
                ? new TransformConfig(defaultParams.length) : new TransformConfig(transformConfig);
    }

    public void setTransformConfig(TransformConfig transformConfig) {
        this.transformConfig = transformConfig == null ? null : new TransformConfig(transformConfig);
    }

    public Bounds getBounds() {
        return bounds;
    }

    public void setBounds(Bounds bounds) {
        this.bounds = bounds;
    }

    public RateBound getRateBound() {
        return rateBound;
    }

    public void setRateBound(RateBound rateBound) {
        this.rateBound = rateBound;
    }

    public double getCostThreshold() {
        return costThreshold;
    }

    public void setCostThreshold(double costThreshold) {
        this.costThreshold = costThreshold;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

}

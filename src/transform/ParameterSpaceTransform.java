package transform;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.exception.ZeroException;

/**
 * Bijective mapping between the original parameter space and the input
 * parameter space, built from one {@link ParameterTransform} per parameter.
 * <p>
 * To input space: divide by the default parameter (if scale factors are used),
 * then take the log (if the parameter is log transformed). To original space:
 * the exact inverse, exp first then unscale.
 * </p>
 *
 * @author Ben Hui
 */
public class ParameterSpaceTransform {

    private final ParameterTransform[] transforms;

    public ParameterSpaceTransform(double[] defaultParams, TransformConfig config) {
        if (config.getNumParam() != defaultParams.length) {
            throw new DimensionMismatchException(config.getNumParam(), defaultParams.length);
        }
        transforms = new ParameterTransform[defaultParams.length];
        for (int i = 0; i < defaultParams.length; i++) {
            if (!Double.isFinite(defaultParams[i])) {
                throw new NotFiniteNumberException(defaultParams[i]);
            }
            double scale = 1;
            if (config.isUseScaleFactor()) {
                if (defaultParams[i] == 0) {
                    throw new ZeroException();
                }
                scale = defaultParams[i];
            }
            if (config.isLogTransformed(i)) {
                transforms[i] = new ParameterTransformLog(scale);
            } else {
                transforms[i] = new ParameterTransformLinear(scale);
            }
        }
    }

    public int getNumParam() {
        return transforms.length;
    }

    public ParameterTransform getTransform(int index) {
        return transforms[index];
    }

    public ParameterVector toInput(ParameterVector original) {
        original.requireSpace(ParameterSpace.ORIGINAL);
        return new ParameterVector(convertParameter(original.toArray(), false), ParameterSpace.INPUT);
    }

    public ParameterVector toOriginal(ParameterVector input) {
        input.requireSpace(ParameterSpace.INPUT);
        return new ParameterVector(convertParameter(input.toArray(), true), ParameterSpace.ORIGINAL);
    }

    public double[] toInput(double[] original) {
        return convertParameter(original, false);
    }

    public double[] toOriginal(double[] input) {
        return convertParameter(input, true);
    }

    private double[] convertParameter(double[] p, boolean toOriginal) {
        if (p.length != transforms.length) {
            throw new DimensionMismatchException(p.length, transforms.length);
        }
        double[] res = new double[p.length];
        for (int i = 0; i < res.length; i++) {
            if (toOriginal) {
                res[i] = transforms[i].toOriginal(p[i]);
            } else {
                res[i] = transforms[i].toInput(p[i]);
            }
        }
        return res;
    }

}

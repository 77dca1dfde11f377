package transform;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;

/**
 * Parameter transformation that scales then takes the natural log. The inverse
 * exponentiates first and unscales after.
 *
 * @author Ben Hui
 */
public class ParameterTransformLog extends ParameterTransform {

    public ParameterTransformLog(double scale) {
        super(scale);
    }

    @Override
    public double toInput(double p) {
        double scaled = p / scale;
        if (!(scaled > 0)) {
            throw new NotStrictlyPositiveException(scaled);
        }
        return Math.log(scaled);
    }

    @Override
    public double toOriginal(double x) {
        return Math.exp(x) * scale;
    }

}

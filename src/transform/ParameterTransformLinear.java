package transform;

/**
 * Parameter transformation using a multiplicative scale factor only. A scale of
 * 1 gives the identity mapping.
 *
 * @author Ben Hui
 */
public class ParameterTransformLinear extends ParameterTransform {

    public ParameterTransformLinear(double scale) {
        super(scale);
    }

    @Override
    public double toInput(double p) {
        return p / scale;
    }

    @Override
    public double toOriginal(double x) {
        return x * scale;
    }

}

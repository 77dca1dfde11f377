package transform;

/**
 * An abstract class define the mapping of a single parameter between the
 * original parameter space (the value consumed by the simulator) and the input
 * space (the value manipulated by an optimiser)
 *
 * @author Ben Hui
 */
public abstract class ParameterTransform {

    protected final double scale;

    public ParameterTransform(double scale) {
        this.scale = scale;
    }

    public double getScale() {
        return scale;
    }

    public abstract double toInput(double p); // To be called when defining initial value

    public abstract double toOriginal(double x); // To be called before the simulator is run

}

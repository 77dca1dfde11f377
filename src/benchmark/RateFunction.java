package benchmark;

/**
 * A transition rate as a function of the (original space) parameters and the
 * membrane voltage. Used to derive rate bounds.
 */
public abstract class RateFunction {

    public enum Polarity {
        POSITIVE, NEGATIVE
    }

    private final Polarity polarity;

    public RateFunction(Polarity polarity) {
        this.polarity = polarity;
    }

    public Polarity getPolarity() {
        return polarity;
    }

    public abstract double rate(double[] param, double voltage);

}

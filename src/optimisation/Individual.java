package optimisation;

import transform.ParameterVector;

/**
 * A member of a population: an input space parameter vector and its cost. The
 * cost is NaN until the individual has been evaluated.
 */
public class Individual {

    private final ParameterVector x;
    private double cost = Double.NaN;

    public Individual(ParameterVector x) {
        this.x = x;
    }

    public Individual(ParameterVector x, double cost) {
        this.x = x;
        this.cost = cost;
    }

    public ParameterVector getX() {
        return x;
    }

    public double getCost() {
        return cost;
    }

    public void setCost(double cost) {
        this.cost = cost;
    }

    public boolean hasCost() {
        return !Double.isNaN(cost);
    }

    public Individual copy() {
        return new Individual(x, cost);
    }

    @Override
    public String toString() {
        return x + " cost = " + cost;
    }

}

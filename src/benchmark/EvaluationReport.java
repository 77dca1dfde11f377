package benchmark;

/**
 * Performance of the final parameters of an optimisation run.
 */
public class EvaluationReport {

    private final int solveCount;
    private final double cost;
    private final double bestCost;
    private final double paramRMSRE;
    private final int identifiedCount;
    private final int numParam;

    public EvaluationReport(int solveCount, double cost, double bestCost,
            double paramRMSRE, int identifiedCount, int numParam) {
        this.solveCount = solveCount;
        this.cost = cost;
        this.bestCost = bestCost;
        this.paramRMSRE = paramRMSRE;
        this.identifiedCount = identifiedCount;
        this.numParam = numParam;
    }

    public int getSolveCount() {
        return solveCount;
    }

    public double getCost() {
        return cost;
    }

    /**
     * Lowest cost seen over the run, including the final evaluation.
     */
    public double getBestCost() {
        return bestCost;
    }

    public double getParamRMSRE() {
        return paramRMSRE;
    }

    public int getIdentifiedCount() {
        return identifiedCount;
    }

    public int getNumParam() {
        return numParam;
    }

    @Override
    public String toString() {
        return String.format("Number of cost evaluations:      %d%n"
                + "Final cost:                      %.6f%n"
                + "Best cost:                       %.6f%n"
                + "Parameter RMSRE:                 %.6f%n"
                + "Number of identified parameters: %d%n"
                + "Total number of parameters:      %d",
                solveCount, cost, bestCost, paramRMSRE, identifiedCount, numParam);
    }

}

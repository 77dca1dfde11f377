package optimisation;

import benchmark.Benchmarker;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import transform.ParameterVector;

/**
 * Elitist genetic algorithm built on {@link PopulationPrimitives}.
 * <p>
 * Each generation: save elites, tournament selection, crossover, mutation,
 * evaluate, re-insert elites. Defaults follow:
 * </p>
 * <pre>
 * Smirnov D, Pikunov A, Syunyaev R, et al.
 * Genetic algorithm-based personalized models of human cardiac action potential.
 * PLoS One. 2020;15(5):e0231695.
 * </pre>
 *
 * @author Ben Hui
 */
public class GeneticAlgorithmOptimiser extends AbstractParameterOptimiser {

    private static final Logger LOG = LoggerFactory.getLogger(GeneticAlgorithmOptimiser.class);

    public static final int PARAM_GA_OPT_POP_SIZE = 0;
    public static final int PARAM_GA_OPT_NUM_GEN = PARAM_GA_OPT_POP_SIZE + 1;
    public static final int PARAM_GA_OPT_ELITE_PROP = PARAM_GA_OPT_NUM_GEN + 1;
    public static final int PARAM_GA_OPT_CROSSOVER = PARAM_GA_OPT_ELITE_PROP + 1;
    public static final int PARAM_GA_OPT_MUTATION = PARAM_GA_OPT_CROSSOVER + 1;

    protected Object[] paramList = {
        //0: PARAM_GA_OPT_POP_SIZE
        50,
        //1: PARAM_GA_OPT_NUM_GEN
        50,
        //2: PARAM_GA_OPT_ELITE_PROP
        // Proportion of population kept as elites, rounded, at least one
        0.066,
        //3: PARAM_GA_OPT_CROSSOVER
        new SimulatedBinaryCrossover(10),
        //4: PARAM_GA_OPT_MUTATION
        new CauchyMutation(),};

    protected final PopulationPrimitives primitives;
    protected List<Individual> GA_POP = null;
    protected int generation = 0;

    public GeneticAlgorithmOptimiser(Benchmarker bm) {
        super(bm);
        primitives = new PopulationPrimitives(bm);
    }

    @Override
    public Object setParameter(int paramId, Object newParm) {
        Object oldParam = paramList[paramId];
        paramList[paramId] = newParm;
        return oldParam;
    }

    @Override
    public Object getParameter(int paramId) {
        return paramList[paramId];
    }

    public List<Individual> getPopulation() {
        return GA_POP;
    }

    public int getGeneration() {
        return generation;
    }

    protected int getEliteCount() {
        int popSize = (Integer) paramList[PARAM_GA_OPT_POP_SIZE];
        double eliteProp = ((Number) paramList[PARAM_GA_OPT_ELITE_PROP]).doubleValue();
        return Math.min(popSize, Math.max(1, (int) Math.round(popSize * eliteProp)));
    }

    @Override
    public void initialise() {
        int popSize = (Integer) paramList[PARAM_GA_OPT_POP_SIZE];
        if (popSize < 2) {
            throw new IllegalArgumentException("Population size must be at least 2, got " + popSize);
        }
        LOG.info("Generating new GA population of size {}", popSize);
        GA_POP = primitives.initialise(X0, popSize);
        primitives.evaluatePopulation(GA_POP);
        generation = 0;
        bestX = null;
        baseCost = Double.POSITIVE_INFINITY;
        setOptStopped(false);
    }

    @Override
    protected void handleResults() {
        Individual best = primitives.getElites(GA_POP, 1).get(0);
        if (bestX == null || best.getCost() < baseCost) {
            bestX = best.getX();
            baseCost = best.getCost();
        }
        LOG.info("Gen {}, best cost: {}, solve count: {}", generation, baseCost,
                bm.getTracker().getSolveCount());
    }

    @Override
    public ParameterVector optimise() {
        if (GA_POP == null) {
            initialise();
        }
        int numGen = (Integer) paramList[PARAM_GA_OPT_NUM_GEN];
        CrossoverOperator crossover = (CrossoverOperator) paramList[PARAM_GA_OPT_CROSSOVER];
        MutationOperator mutation = (MutationOperator) paramList[PARAM_GA_OPT_MUTATION];
        int eliteCount = getEliteCount();

        while (!isOptStopped() && generation < numGen) {
            List<Individual> elites = primitives.getElites(GA_POP, eliteCount);
            handleResults();

            List<Individual> pop = primitives.tournamentSelection(GA_POP);
            pop = primitives.crossover(pop, crossover);
            pop = primitives.mutate(pop, mutation);
            primitives.evaluatePopulation(pop);
            GA_POP = primitives.setElites(pop, elites);

            generation++;
            if (bm.isConverged()) {
                LOG.info("GA stopped at gen {} as cost threshold reached", generation);
                setOptStopped(true);
            }
        }
        handleResults();
        setOptStopped(true);

        report = bm.evaluate(bestX);
        return bestX;
    }

}

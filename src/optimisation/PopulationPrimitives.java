package optimisation;

import benchmark.Benchmarker;
import benchmark.Bounds;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;
import transform.ParameterSpace;
import transform.ParameterVector;

/**
 * Generic population operators shared by the population based optimisers:
 * initialisation, evaluation, elite extraction and re-insertion, tournament
 * selection, crossover and mutation.
 * <p>
 * Individuals are value-like. Every operator returns a new list and copies
 * the individuals it keeps, so later changes to one population never alter
 * another (or a saved set of elites).
 * </p>
 */
public class PopulationPrimitives {

    private final Benchmarker bm;
    private final RandomGenerator rng;

    public static final Comparator<Individual> COST_COMPARATOR = new Comparator<Individual>() {
        @Override
        public int compare(Individual t, Individual t1) {
            return Double.compare(t.getCost(), t1.getCost());
        }
    };

    public PopulationPrimitives(Benchmarker bm) {
        this(bm, bm.getRandomGenerator());
    }

    public PopulationPrimitives(Benchmarker bm, RandomGenerator rng) {
        this.bm = bm;
        this.rng = rng;
    }

    /**
     * @param x0 input space initial guess, or null to sample the population
     * @param size population size
     * @return population with no costs set
     */
    public List<Individual> initialise(ParameterVector x0, int size) {
        List<Individual> pop = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ParameterVector x;
            if (x0 == null) {
                x = bm.sample();
            } else {
                double[] p = bm.originalParameterSpace(x0).toArray();
                for (int j = 0; j < p.length; j++) {
                    p[j] = p[j] * (0.5 + rng.nextDouble());
                }
                // Clipped in input space, log parameters may have a bound at zero
                x = bm.clampParameters(bm.inputParameterSpace(ParameterVector.original(p)));
            }
            pop.add(new Individual(x));
        }
        return pop;
    }

    /**
     * Finds the cost of every individual without one. Individuals already
     * evaluated are left alone.
     */
    public List<Individual> evaluatePopulation(List<Individual> pop) {
        for (Individual ind : pop) {
            if (!ind.hasCost()) {
                ind.setCost(bm.cost(ind.getX()));
            }
        }
        return pop;
    }

    /**
     * @return copies of the k lowest cost individuals, ties in population order
     */
    public List<Individual> getElites(List<Individual> pop, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("Number of elites must be non-negative, got " + k);
        }
        requireCosts(pop);
        List<Individual> sorted = new ArrayList<>(pop);
        // Stable
        Collections.sort(sorted, COST_COMPARATOR);
        List<Individual> elites = new ArrayList<>(Math.min(k, sorted.size()));
        for (int i = 0; i < k && i < sorted.size(); i++) {
            elites.add(sorted.get(i).copy());
        }
        return elites;
    }

    /**
     * Replaces the worst individuals with copies of the elites, so the best
     * cost in the population never gets worse than the best elite.
     */
    public List<Individual> setElites(List<Individual> pop, List<Individual> elites) {
        requireCosts(pop);
        final List<Individual> res = copyOf(pop);

        List<Integer> order = new ArrayList<>(res.size());
        for (int i = 0; i < res.size(); i++) {
            order.add(i);
        }
        // Worst first
        Collections.sort(order, new Comparator<Integer>() {
            @Override
            public int compare(Integer t, Integer t1) {
                return Double.compare(res.get(t1).getCost(), res.get(t).getCost());
            }
        });

        for (int e = 0; e < elites.size() && e < order.size(); e++) {
            res.set(order.get(e), elites.get(e).copy());
        }
        return res;
    }

    /**
     * Two passes, each over a random permutation of the population. Each
     * adjacent pair in a permutation sends the lower cost individual (the
     * second one on a tie) to the new population. For odd sizes one extra
     * tournament fills the last slot.
     */
    public List<Individual> tournamentSelection(List<Individual> pop) {
        requireCosts(pop);
        int popSize = pop.size();
        List<Individual> newPop = new ArrayList<>(popSize);
        for (int pass = 0; pass < 2; pass++) {
            int[] perm = MathArrays.natural(popSize);
            MathArrays.shuffle(perm, rng);
            for (int i = 0; i < popSize / 2; i++) {
                newPop.add(tournament(pop.get(perm[2 * i]), pop.get(perm[2 * i + 1])));
            }
        }
        if (newPop.size() < popSize) {
            int a = rng.nextInt(popSize);
            int b = popSize > 1 ? (a + 1 + rng.nextInt(popSize - 1)) % popSize : a;
            newPop.add(tournament(pop.get(a), pop.get(b)));
        }
        return newPop;
    }

    private static Individual tournament(Individual a, Individual b) {
        if (a.getCost() < b.getCost()) {
            return a.copy();
        } else {
            return b.copy();
        }
    }

    /**
     * Recombines consecutive pairs into two offspring each, bounded to the
     * parameter bounds in input space. Offspring have no cost. An odd trailing
     * individual is carried over unchanged.
     */
    public List<Individual> crossover(List<Individual> pop, CrossoverOperator operator) {
        double[][] inputBounds = bm.getInputBounds();
        List<Individual> newPop = new ArrayList<>(pop.size());
        for (int i = 0; i + 1 < pop.size(); i += 2) {
            double[][] offspring = operator.crossover(pop.get(i).getX().toArray(), pop.get(i + 1).getX().toArray(),
                    inputBounds[Bounds.LIMIT_L], inputBounds[Bounds.LIMIT_U], rng);
            newPop.add(new Individual(new ParameterVector(offspring[0], ParameterSpace.INPUT)));
            newPop.add(new Individual(new ParameterVector(offspring[1], ParameterSpace.INPUT)));
        }
        if (pop.size() % 2 == 1) {
            newPop.add(pop.get(pop.size() - 1).copy());
        }
        return newPop;
    }

    /**
     * Applies the mutation to every individual. Only individuals that actually
     * moved lose their cost.
     */
    public List<Individual> mutate(List<Individual> pop, MutationOperator operator) {
        double[][] inputBounds = bm.getInputBounds();
        List<Individual> newPop = new ArrayList<>(pop.size());
        for (Individual ind : pop) {
            double[] x = ind.getX().toArray();
            double[] mutated = operator.mutate(x, inputBounds[Bounds.LIMIT_L], inputBounds[Bounds.LIMIT_U], rng);
            if (Arrays.equals(x, mutated)) {
                newPop.add(ind.copy());
            } else {
                newPop.add(new Individual(new ParameterVector(mutated, ParameterSpace.INPUT)));
            }
        }
        return newPop;
    }

    private static List<Individual> copyOf(List<Individual> pop) {
        List<Individual> res = new ArrayList<>(pop.size());
        for (Individual ind : pop) {
            res.add(ind.copy());
        }
        return res;
    }

    private static void requireCosts(List<Individual> pop) {
        for (Individual ind : pop) {
            if (!ind.hasCost()) {
                throw new IllegalStateException("Population contains individuals with no cost: " + ind);
            }
        }
    }

}

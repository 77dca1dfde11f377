package optimisation;

import benchmark.Benchmarker;
import benchmark.BenchmarkerConfig;
import benchmark.Bounds;
import benchmark.LinearTraceSimulator;
import java.util.ArrayList;
import java.util.List;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import transform.ParameterVector;

public class Test_PopulationPrimitives {

    private static final double[] DEFAULTS = {1.0, 2.0};

    private Benchmarker bm;
    private PopulationPrimitives primitives;

    @BeforeEach
    public void setUp() {
        BenchmarkerConfig config = LinearTraceSimulator.config(DEFAULTS, DEFAULTS);
        config.setBounds(new Bounds(new double[]{0, 0}, new double[]{3, 3}));
        bm = new Benchmarker(config, new LinearTraceSimulator());
        primitives = new PopulationPrimitives(bm);
    }

    private static List<Individual> withCosts(double... costs) {
        List<Individual> pop = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            pop.add(new Individual(ParameterVector.input(i, i), costs[i]));
        }
        return pop;
    }

    private static double minCost(List<Individual> pop) {
        double min = Double.POSITIVE_INFINITY;
        for (Individual ind : pop) {
            min = Math.min(min, ind.getCost());
        }
        return min;
    }

    @Test
    public void elitesSurviveAWorseGeneration() {
        List<Individual> pop = withCosts(5, 3, 8, 1);
        List<Individual> elites = primitives.getElites(pop, 1);
        assertEquals(1, elites.size());
        assertEquals(1.0, elites.get(0).getCost());
        assertEquals(pop.get(3).getX(), elites.get(0).getX());

        List<Individual> next = primitives.setElites(withCosts(9, 9, 9, 9), elites);
        assertEquals(4, next.size());
        assertEquals(1.0, minCost(next));
    }

    @Test
    public void elitesAreCopies() {
        List<Individual> pop = withCosts(5, 3, 8, 1);
        List<Individual> elites = primitives.getElites(pop, 2);
        assertEquals(3.0, elites.get(1).getCost());
        elites.get(0).setCost(100);
        assertEquals(1.0, pop.get(3).getCost());

        List<Individual> next = primitives.setElites(pop, primitives.getElites(pop, 2));
        next.get(0).setCost(-1);
        assertEquals(5.0, pop.get(0).getCost());
    }

    @Test
    public void elitesReplaceTheWorst() {
        List<Individual> pop = withCosts(4, 7, 2, 9);
        List<Individual> elites = withCosts(0.5, 0.25);
        List<Individual> next = primitives.setElites(pop, elites);
        assertEquals(0.5, next.get(3).getCost());
        assertEquals(0.25, next.get(1).getCost());
        assertEquals(4.0, next.get(0).getCost());
        assertEquals(2.0, next.get(2).getCost());
    }

    @Test
    public void operatorsNeedCosts() {
        final List<Individual> pop = withCosts(1, 2);
        pop.add(new Individual(ParameterVector.input(1, 1)));
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                primitives.getElites(pop, 1);
            }
        });
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                primitives.tournamentSelection(pop);
            }
        });
    }

    @Test
    public void tournamentKeepsPopulationSize() {
        assertEquals(6, primitives.tournamentSelection(withCosts(6, 5, 4, 3, 2, 1)).size());
        assertEquals(5, primitives.tournamentSelection(withCosts(5, 4, 3, 2, 1)).size());
        assertEquals(1, primitives.tournamentSelection(withCosts(1)).size());
    }

    @Test
    public void tournamentFavoursLowCost() {
        List<Individual> pop = withCosts(6, 5, 4, 3, 2, 1);
        for (int rep = 0; rep < 20; rep++) {
            List<Individual> selected = primitives.tournamentSelection(pop);
            int bestCount = 0;
            for (Individual ind : selected) {
                assertNotEquals(6.0, ind.getCost());
                if (ind.getCost() == 1.0) {
                    bestCount++;
                }
            }
            // The best wins its tournament in both passes
            assertEquals(2, bestCount);
        }
    }

    @Test
    public void crossoverStaysInBounds() {
        List<Individual> pop = primitives.initialise(null, 5);
        primitives.evaluatePopulation(pop);
        List<Individual> offspring = primitives.crossover(pop, new SimulatedBinaryCrossover(2, 1, 1));

        assertEquals(5, offspring.size());
        for (int i = 0; i < 4; i++) {
            assertFalse(offspring.get(i).hasCost());
            assertTrue(bm.isFeasible(offspring.get(i).getX()));
        }
        // Odd one out carried over with its cost
        assertTrue(offspring.get(4).hasCost());
        assertEquals(pop.get(4).getX(), offspring.get(4).getX());
    }

    @Test
    public void singlePointCrossoverSwapsTails() {
        List<Individual> pop = new ArrayList<>();
        pop.add(new Individual(ParameterVector.input(1, 1), 1));
        pop.add(new Individual(ParameterVector.input(2, 2), 2));
        List<Individual> offspring = primitives.crossover(pop, new SinglePointCrossover());
        assertArrayEquals(new double[]{1, 2}, offspring.get(0).getX().toArray());
        assertArrayEquals(new double[]{2, 1}, offspring.get(1).getX().toArray());
    }

    @Test
    public void mutationResetsCostOfMovedIndividuals() {
        List<Individual> pop = withCosts(1, 2, 3);
        List<Individual> unchanged = primitives.mutate(pop, new CauchyMutation(0.18, 0));
        for (int i = 0; i < pop.size(); i++) {
            assertTrue(unchanged.get(i).hasCost());
            assertEquals(pop.get(i).getX(), unchanged.get(i).getX());
        }

        List<Individual> moved = primitives.mutate(pop, new CauchyMutation(0.18, 1));
        for (int i = 0; i < pop.size(); i++) {
            assertFalse(moved.get(i).hasCost());
            assertTrue(pop.get(i).hasCost());
        }
    }

    @Test
    public void polynomialMutationStaysInBounds() {
        List<Individual> pop = primitives.initialise(null, 20);
        List<Individual> moved = primitives.mutate(pop, new PolynomialMutation(20, 1));
        for (Individual ind : moved) {
            assertTrue(bm.isFeasible(ind.getX()));
        }
    }

    @Test
    public void initialiseAroundStartingPoint() {
        ParameterVector x0 = bm.inputParameterSpace(ParameterVector.original(2.5, 2.0));
        List<Individual> pop = primitives.initialise(x0, 30);
        assertEquals(30, pop.size());
        for (Individual ind : pop) {
            assertFalse(ind.hasCost());
            double[] p = bm.originalParameterSpace(ind.getX()).toArray();
            // 2.5 * [0.5, 1.5] clipped to 3
            assertTrue(p[0] >= 1.25 && p[0] <= 3.0, "p0 = " + p[0]);
            assertTrue(p[1] >= 1.0 && p[1] <= 3.0, "p1 = " + p[1]);
        }
    }

    @Test
    public void evaluateOnlyMissingCosts() {
        List<Individual> pop = primitives.initialise(null, 4);
        pop.get(0).setCost(42);
        primitives.evaluatePopulation(pop);
        assertEquals(3, bm.getTracker().getSolveCount());
        assertEquals(42.0, pop.get(0).getCost());
        for (Individual ind : pop) {
            assertTrue(ind.hasCost());
        }
    }

}

package salesman.heuristics.ga;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.log4j.Logger;

import salesman.heuristics.ProgressSink;
import salesman.heuristics.SteppableHeuristic;
import salesman.problem.Problem;
import salesman.problem.Tour;
import salesman.utils.ConfigurationException;
import salesman.utils.Rng;

/**
 * Generational GA over tours: elitism, tournament selection, order crossover
 * and swap mutation. Each {@link #step()} produces exactly one generation.
 */
public class GeneticAlgorithm implements SteppableHeuristic {

	private static Logger log = Logger.getLogger(GeneticAlgorithm.class);

	public static final double EPSILON = 1e-9;

	public enum State {
		RUNNING, CONVERGED, EXHAUSTED
	}

	private final Problem problem;
	private final GAParams params;
	private final Rng rng;
	private ProgressSink sink = ProgressSink.NONE;

	private List<Tour> population;
	private Tour bestEver;
	private int generation;
	private int stall;
	private State state;

	public GeneticAlgorithm(Problem problem, GAParams params, Rng rng) {
		ConfigurationException.require(problem.numCities() >= 3, "Need at least 3 cities, got " + problem.numCities());
		this.problem = problem;
		this.params = params.validate();
		this.rng = rng;
		initialize();
	}

	public synchronized void initialize() {
		population = PermutationOperators.initPopulation(params.getPopulationSize(), problem.numCities(), rng);
		evaluate(population);
		Collections.sort(population);

		bestEver = population.get(0).copy();
		generation = 0;
		stall = 0;
		state = State.RUNNING;
		log.debug("Initialized population of " + population.size() + ", best: " + bestEver.getLength());
	}

	// deterministic tournament, draws with replacement
	public static int tournamentSelect(List<Tour> population, Rng rng, int k) {
		int best = rng.randInt(0, population.size() - 1);
		for (int i = 1; i < k; i++) {
			int idx = rng.randInt(0, population.size() - 1);
			if (population.get(idx).getLength() < population.get(best).getLength())
				best = idx;
		}
		return best;
	}

	@Override
	public synchronized boolean step() {
		if (state != State.RUNNING)
			return false;

		List<Tour> next = new ArrayList<Tour>(population.size());
		for (int e = 0; e < params.getElitism(); e++)
			next.add(population.get(e).copy());

		while (next.size() < population.size()) {
			Tour a = population.get(tournamentSelect(population, rng, params.getTournamentK()));
			Tour b = population.get(tournamentSelect(population, rng, params.getTournamentK()));
			Tour child = PermutationOperators.orderCrossover(a, b, rng);
			PermutationOperators.swapMutation(child, params.getMutationRate(), rng);
			next.add(child);
		}

		evaluate(next);
		Collections.sort(next);
		population = next;

		boolean improved = population.get(0).getLength() + EPSILON < bestEver.getLength();
		if (improved) {
			bestEver = population.get(0).copy();
			stall = 0;
		} else
			stall++;
		generation++;

		if (improved || generation % 100 == 0)
			logStatistics();

		if (stall >= params.getStallLimit()) {
			state = State.CONVERGED;
			log.info("GA converged after " + generation + " generations, best: " + bestEver.getLength());
		} else if (generation >= params.getGenerations()) {
			state = State.EXHAUSTED;
			log.info("GA exhausted " + generation + " generations, best: " + bestEver.getLength());
		}

		sink.append(generation, bestEver.getLength());
		return state == State.RUNNING;
	}

	private void evaluate(List<Tour> tours) {
		for (Tour t : tours)
			t.evaluate(problem);
	}

	private void logStatistics() {
		if (!log.isDebugEnabled())
			return;
		DescriptiveStatistics ds = new DescriptiveStatistics();
		for (Tour t : population)
			ds.addValue(t.getLength());
		log.debug(generation + "," + stall + "," + ds.getMin() + "," + ds.getMean() + "," + ds.getMax() + "," + ds.getStandardDeviation());
	}

	@Override
	public String getName() {
		return "GA";
	}

	@Override
	public synchronized void setProgressSink(ProgressSink sink) {
		this.sink = sink == null ? ProgressSink.NONE : sink;
	}

	public synchronized Tour getCurrentBest() {
		return population.get(0).copy();
	}

	@Override
	public synchronized Tour getBestEver() {
		return bestEver.copy();
	}

	public synchronized List<Tour> getPopulation() {
		List<Tour> l = new ArrayList<Tour>(population.size());
		for (Tour t : population)
			l.add(t.copy());
		return l;
	}

	public synchronized int getGeneration() {
		return generation;
	}

	@Override
	public long getProgress() {
		return getGeneration();
	}

	public synchronized int getStall() {
		return stall;
	}

	public synchronized State getState() {
		return state;
	}

	@Override
	public synchronized boolean isFinished() {
		return state != State.RUNNING;
	}

	public GAParams getParams() {
		return params;
	}
}

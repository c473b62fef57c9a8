package salesman.heuristics.ga;

import static salesman.utils.ConfigurationException.require;

import salesman.utils.ConfigurationException;

/**
 * Immutable settings of a {@link GeneticAlgorithm} run.
 */
public final class GAParams {

	private final int populationSize;
	private final int generations;
	private final double mutationRate;
	private final int tournamentK;
	private final int elitism;
	private final int stallLimit;

	public GAParams(int populationSize, int generations, double mutationRate, int tournamentK, int elitism, int stallLimit) {
		this.populationSize = populationSize;
		this.generations = generations;
		this.mutationRate = mutationRate;
		this.tournamentK = tournamentK;
		this.elitism = elitism;
		this.stallLimit = stallLimit;
	}

	// defaults scaled with the number of cities
	public static GAParams forCities(int numCities) {
		int pop, gens;
		try {
			pop = Math.multiplyExact(numCities, 10);
			gens = Math.multiplyExact(numCities, 500);
		} catch (ArithmeticException e) {
			throw new ConfigurationException("Too many cities for default GA settings: " + numCities, e);
		}
		return new GAParams(pop, gens, 0.1, Math.max(2, (int) (pop * 0.001)), (int) (pop * 0.03), Math.max(1, gens / 10));
	}

	public GAParams validate() {
		require(populationSize >= 2, "populationSize must be >= 2: " + populationSize);
		require(generations >= 1, "generations must be >= 1: " + generations);
		require(mutationRate >= 0 && mutationRate <= 1, "mutationRate must be in [0,1]: " + mutationRate);
		require(tournamentK >= 1, "tournamentK must be >= 1: " + tournamentK);
		require(elitism >= 0, "elitism must be >= 0: " + elitism);
		require(elitism < populationSize, "elitism must be < populationSize: " + elitism + " >= " + populationSize);
		require(stallLimit >= 1, "stallLimit must be >= 1: " + stallLimit);
		return this;
	}

	public GAParams withPopulationSize(int v) {
		return new GAParams(v, generations, mutationRate, tournamentK, elitism, stallLimit);
	}

	public GAParams withGenerations(int v) {
		return new GAParams(populationSize, v, mutationRate, tournamentK, elitism, stallLimit);
	}

	public GAParams withMutationRate(double v) {
		return new GAParams(populationSize, generations, v, tournamentK, elitism, stallLimit);
	}

	public GAParams withTournamentK(int v) {
		return new GAParams(populationSize, generations, mutationRate, v, elitism, stallLimit);
	}

	public GAParams withElitism(int v) {
		return new GAParams(populationSize, generations, mutationRate, tournamentK, v, stallLimit);
	}

	public GAParams withStallLimit(int v) {
		return new GAParams(populationSize, generations, mutationRate, tournamentK, elitism, v);
	}

	public int getPopulationSize() {
		return populationSize;
	}

	public int getGenerations() {
		return generations;
	}

	public double getMutationRate() {
		return mutationRate;
	}

	public int getTournamentK() {
		return tournamentK;
	}

	public int getElitism() {
		return elitism;
	}

	public int getStallLimit() {
		return stallLimit;
	}

	@Override
	public String toString() {
		return "GAParams[populationSize=" + populationSize + ", generations=" + generations + ", mutationRate=" + mutationRate
				+ ", tournamentK=" + tournamentK + ", elitism=" + elitism + ", stallLimit=" + stallLimit + "]";
	}
}

package salesman.heuristics.sa;

import static salesman.utils.ConfigurationException.require;

import salesman.utils.ConfigurationException;

/**
 * Immutable settings of a {@link SimulatedAnnealing} run. Unless another
 * schedule is set, the temperature is cooled with {@link ReciprocalCooling}
 * using alpha.
 */
public final class SAParams {

	private final double initialTemp;
	private final double finalTemp;
	private final double alpha;
	private final int neighborsPerTemp;
	private final int stallLimit;
	private final CoolingSchedule cooling;

	public SAParams(double initialTemp, double finalTemp, double alpha, int neighborsPerTemp, int stallLimit) {
		this(initialTemp, finalTemp, alpha, neighborsPerTemp, stallLimit, new ReciprocalCooling(alpha));
	}

	private SAParams(double initialTemp, double finalTemp, double alpha, int neighborsPerTemp, int stallLimit, CoolingSchedule cooling) {
		this.initialTemp = initialTemp;
		this.finalTemp = finalTemp;
		this.alpha = alpha;
		this.neighborsPerTemp = neighborsPerTemp;
		this.stallLimit = stallLimit;
		this.cooling = cooling;
	}

	public static SAParams forCities(int numCities) {
		int stallLimit;
		try {
			stallLimit = Math.multiplyExact(1000, numCities);
		} catch (ArithmeticException e) {
			throw new ConfigurationException("Too many cities for default SA settings: " + numCities, e);
		}
		return new SAParams(1000.0, 1e-3, 1.0 / (0.2 * numCities), 5, stallLimit);
	}

	public SAParams validate() {
		require(initialTemp > 0 && !Double.isInfinite(initialTemp), "initialTemp must be finite and > 0: " + initialTemp);
		require(finalTemp > 0, "finalTemp must be > 0: " + finalTemp);
		require(finalTemp < initialTemp, "finalTemp must be < initialTemp: " + finalTemp + " >= " + initialTemp);
		require(alpha >= 0 && !Double.isInfinite(alpha), "alpha must be finite and >= 0: " + alpha);
		require(neighborsPerTemp >= 1, "neighborsPerTemp must be >= 1: " + neighborsPerTemp);
		require(stallLimit >= 1, "stallLimit must be >= 1: " + stallLimit);
		require(cooling != null, "No cooling schedule");
		cooling.validate();
		return this;
	}

	public SAParams withCooling(CoolingSchedule cooling) {
		return new SAParams(initialTemp, finalTemp, alpha, neighborsPerTemp, stallLimit, cooling);
	}

	public double getInitialTemp() {
		return initialTemp;
	}

	public double getFinalTemp() {
		return finalTemp;
	}

	public double getAlpha() {
		return alpha;
	}

	public int getNeighborsPerTemp() {
		return neighborsPerTemp;
	}

	public int getStallLimit() {
		return stallLimit;
	}

	public CoolingSchedule getCooling() {
		return cooling;
	}

	@Override
	public String toString() {
		return "SAParams[initialTemp=" + initialTemp + ", finalTemp=" + finalTemp + ", cooling=" + cooling + ", neighborsPerTemp="
				+ neighborsPerTemp + ", stallLimit=" + stallLimit + "]";
	}
}

package salesman.heuristics.sa;

import org.apache.log4j.Logger;

import salesman.heuristics.ProgressSink;
import salesman.heuristics.SteppableHeuristic;
import salesman.problem.Problem;
import salesman.problem.Tour;
import salesman.utils.ConfigurationException;
import salesman.utils.Rng;

/**
 * Simulated annealing over tours with 2-opt moves and Metropolis acceptance.
 * One {@link #step()} is one temperature epoch of neighborsPerTemp moves
 * followed by a single cooling.
 */
public class SimulatedAnnealing implements SteppableHeuristic {

	private static Logger log = Logger.getLogger(SimulatedAnnealing.class);

	private final Problem problem;
	private final SAParams params;
	private final Rng rng;
	private ProgressSink sink = ProgressSink.NONE;

	private Tour current;
	private Tour bestEver;
	private double temperature;
	private long iterations;
	private long epochs;
	private int stall;
	private boolean finished;

	public SimulatedAnnealing(Problem problem, SAParams params, Rng rng) {
		ConfigurationException.require(problem.numCities() >= 3, "Need at least 3 cities, got " + problem.numCities());
		this.problem = problem;
		this.params = params.validate();
		this.rng = rng;
		initialize();
	}

	public synchronized void initialize() {
		current = Tour.random(problem.numCities(), rng);
		current.evaluate(problem);
		bestEver = current.copy();
		temperature = params.getInitialTemp();
		iterations = 0;
		epochs = 0;
		stall = 0;
		finished = false;
		log.debug("Initialized with tour of length " + current.getLength() + ", " + params);
	}

	// reverses a random inclusive sub-range of a copy of t
	public static Tour twoOptNeighbor(Tour t, Rng rng) {
		int i = rng.randInt(0, t.size() - 1);
		int j = rng.randInt(0, t.size() - 1);
		if (i > j) {
			int tmp = i;
			i = j;
			j = tmp;
		}
		Tour c = t.copy();
		if (i != j)
			c.reverse(i, j);
		return c;
	}

	public static boolean accept(double currentLength, double candidateLength, double t, Rng rng) {
		if (candidateLength < currentLength)
			return true;
		double delta = candidateLength - currentLength;
		return rng.rand01() < Math.exp(-delta / t);
	}

	@Override
	public synchronized boolean step() {
		if (finished)
			return false;

		for (int n = 0; n < params.getNeighborsPerTemp(); n++) {
			Tour candidate = twoOptNeighbor(current, rng);
			candidate.evaluate(problem);

			if (accept(current.getLength(), candidate.getLength(), temperature, rng))
				current = candidate;

			if (current.getLength() < bestEver.getLength()) {
				bestEver = current.copy();
				stall = 0;
			} else
				stall++;
			iterations++;
		}
		epochs++;

		double next = params.getCooling().next(temperature);
		if (!(next > 0) || Double.isInfinite(next))
			throw new IllegalStateException("Temperature left the positive range: " + temperature + " -> " + next);
		temperature = next;

		if (epochs % 100 == 0 && log.isDebugEnabled())
			log.debug(epochs + "," + temperature + "," + current.getLength() + "," + bestEver.getLength() + "," + stall);

		if (temperature < params.getFinalTemp()) {
			finished = true;
			log.info("SA cooled down after " + iterations + " iterations, best: " + bestEver.getLength());
		} else if (stall >= params.getStallLimit()) {
			finished = true;
			log.info("SA stalled after " + iterations + " iterations, best: " + bestEver.getLength());
		}

		sink.append(iterations, bestEver.getLength());
		return !finished;
	}

	@Override
	public String getName() {
		return "SA";
	}

	@Override
	public synchronized void setProgressSink(ProgressSink sink) {
		this.sink = sink == null ? ProgressSink.NONE : sink;
	}

	public synchronized Tour getCurrent() {
		return current.copy();
	}

	@Override
	public synchronized Tour getBestEver() {
		return bestEver.copy();
	}

	public synchronized double getTemperature() {
		return temperature;
	}

	public synchronized long getIterations() {
		return iterations;
	}

	@Override
	public long getProgress() {
		return getIterations();
	}

	public synchronized long getEpochs() {
		return epochs;
	}

	public synchronized int getStall() {
		return stall;
	}

	@Override
	public synchronized boolean isFinished() {
		return finished;
	}

	public SAParams getParams() {
		return params;
	}
}

package salesman.utils;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Seedable source of the uniform draws used by the heuristics.
 */
public class Rng {

	private final RandomGenerator r;

	public Rng() {
		this(new MersenneTwister());
	}

	public Rng(long seed) {
		this(new MersenneTwister(seed));
	}

	public Rng(RandomGenerator r) {
		this.r = r;
	}

	/**
	 * Uniform integer in [lo, hi], both inclusive.
	 */
	public int randInt(int lo, int hi) {
		if (hi < lo)
			throw new IllegalArgumentException("Empty range [" + lo + ", " + hi + "]");
		return lo + r.nextInt(hi - lo + 1);
	}

	// uniform in [0,1)
	public double rand01() {
		return r.nextDouble();
	}
}

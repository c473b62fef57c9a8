package salesman.heuristics.sa;

import salesman.utils.ConfigurationException;

/**
 * t' = t / (1 + alpha * t). Strictly decreasing for alpha > 0, alpha = 0 keeps
 * the temperature constant.
 */
public class ReciprocalCooling extends CoolingSchedule {

	private final double alpha;

	public ReciprocalCooling(double alpha) {
		this.alpha = alpha;
	}

	@Override
	public double next(double t) {
		return t / (1 + alpha * t);
	}

	@Override
	public void validate() {
		ConfigurationException.require(alpha >= 0 && !Double.isInfinite(alpha), "alpha must be finite and >= 0: " + alpha);
	}

	@Override
	public String toString() {
		return "reciprocal(" + alpha + ")";
	}
}

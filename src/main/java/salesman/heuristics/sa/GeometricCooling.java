package salesman.heuristics.sa;

import salesman.utils.ConfigurationException;

public class GeometricCooling extends CoolingSchedule {

	private final double rate;

	public GeometricCooling(double rate) {
		this.rate = rate;
	}

	@Override
	public double next(double t) {
		return t * rate;
	}

	@Override
	public void validate() {
		ConfigurationException.require(rate > 0 && rate <= 1, "Cooling rate must be in (0,1]: " + rate);
	}

	@Override
	public String toString() {
		return "geometric(" + rate + ")";
	}
}

package salesman.heuristics.sa;

public abstract class CoolingSchedule {

	// temperature of the next epoch, given a positive current temperature
	public abstract double next(double t);

	public abstract void validate();
}

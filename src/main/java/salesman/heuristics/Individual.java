package salesman.heuristics;

public abstract class Individual<T extends Individual<T>> implements Comparable<T> {
	// +inf until scored
	private double value = Double.POSITIVE_INFINITY;

	public void setValue(double value) {
		this.value = value;
	}

	public double getValue() {
		return value;
	}

	public boolean isEvaluated() {
		return value != Double.POSITIVE_INFINITY;
	}

	@Override
	public int compareTo(T o) {
		return Double.compare(value, o.getValue());
	}
}

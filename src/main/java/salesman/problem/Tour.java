package salesman.problem;

import java.util.Arrays;

import salesman.heuristics.Individual;
import salesman.utils.Rng;

/**
 * Visiting order over all cities of a problem, read as a cycle. The length is
 * cached in the individual's value and is +inf until {@link #evaluate(Problem)}
 * is called; changing the order in place resets it.
 */
public class Tour extends Individual<Tour> {

	private final int[] order;

	public Tour(int[] order) {
		this.order = Arrays.copyOf(order, order.length);
	}

	public static Tour identity(int n) {
		int[] o = new int[n];
		for (int i = 0; i < n; i++)
			o[i] = i;
		return new Tour(o);
	}

	// uniform random order, Fisher-Yates from the back
	public static Tour random(int n, Rng rng) {
		int[] o = new int[n];
		for (int i = 0; i < n; i++)
			o[i] = i;
		for (int i = n - 1; i > 0; i--) {
			int j = rng.randInt(0, i);
			int tmp = o[i];
			o[i] = o[j];
			o[j] = tmp;
		}
		return new Tour(o);
	}

	public Tour copy() {
		Tour t = new Tour(order);
		t.setValue(getValue());
		return t;
	}

	public double evaluate(Problem p) {
		double l = p.tourLength(order);
		setValue(l);
		return l;
	}

	public double getLength() {
		return getValue();
	}

	public int size() {
		return order.length;
	}

	public int get(int pos) {
		return order[pos];
	}

	public int[] getOrder() {
		return Arrays.copyOf(order, order.length);
	}

	public void swap(int i, int j) {
		int tmp = order[i];
		order[i] = order[j];
		order[j] = tmp;
		setValue(Double.POSITIVE_INFINITY);
	}

	// reverses the inclusive range [i,j], i <= j
	public void reverse(int i, int j) {
		for (; i < j; i++, j--) {
			int tmp = order[i];
			order[i] = order[j];
			order[j] = tmp;
		}
		setValue(Double.POSITIVE_INFINITY);
	}

	public boolean isPermutation() {
		boolean[] seen = new boolean[order.length];
		for (int c : order) {
			if (c < 0 || c >= order.length || seen[c])
				return false;
			seen[c] = true;
		}
		return true;
	}

	public boolean sameOrder(Tour t) {
		return Arrays.equals(order, t.order);
	}

	@Override
	public String toString() {
		return getValue() + " " + Arrays.toString(order);
	}
}

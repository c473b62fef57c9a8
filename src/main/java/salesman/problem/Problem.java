package salesman.problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.vividsolutions.jts.geom.Envelope;

import salesman.utils.Rng;

/**
 * A set of cities inside a width x height area together with their
 * pairwise euclidean distances. The distance matrix is computed once on
 * construction and never changes afterwards, so a problem can be shared by
 * any number of heuristics.
 */
public class Problem {

	private static Logger log = Logger.getLogger(Problem.class);

	private final List<City> cities;
	private final int width, height;
	private final double[][] dm;

	private Problem(List<City> cities, int width, int height) {
		this.cities = Collections.unmodifiableList(new ArrayList<City>(cities));
		this.width = width;
		this.height = height;
		this.dm = buildDistanceMatrix(this.cities);
	}

	public static Problem build(List<City> cities, int width, int height) {
		if (cities == null || cities.isEmpty())
			throw new IllegalArgumentException("No cities given!");
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Bounds must be positive: " + width + "x" + height);

		// integer positions, x in [0, width-1] and y in [0, height-1]
		Envelope env = new Envelope(0, width - 1, 0, height - 1);
		for (int i = 0; i < cities.size(); i++) {
			City c = cities.get(i);
			if (c.getTag() != i)
				throw new IllegalArgumentException(c + " at index " + i + " must be tagged " + i);
			if (!env.contains(c.toCoordinate()))
				throw new IllegalArgumentException(c + " outside of bounds " + width + "x" + height);
		}
		return new Problem(cities, width, height);
	}

	public static Problem random(int count, int width, int height, Rng rng) {
		if (count <= 0)
			throw new IllegalArgumentException("Number of cities must be positive: " + count);
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Bounds must be positive: " + width + "x" + height);

		List<City> cities = new ArrayList<City>(count);
		for (int i = 0; i < count; i++)
			cities.add(new City(rng.randInt(0, width - 1), rng.randInt(0, height - 1), i));
		log.debug("Generated " + count + " cities within " + width + "x" + height);
		return new Problem(cities, width, height);
	}

	public static double[][] buildDistanceMatrix(List<City> cities) {
		if (cities.isEmpty())
			throw new IllegalArgumentException("No cities given!");

		int n = cities.size();
		double[][] m = new double[n][n];
		for (int i = 0; i < n; i++)
			for (int j = i + 1; j < n; j++) {
				double d = cities.get(i).distance(cities.get(j));
				m[i][j] = d;
				m[j][i] = d;
			}
		return m;
	}

	// closed cycle, includes the edge from the last city back to the first
	public static double tourLength(int[] order, double[][] m) {
		int n = order.length;
		double acc = 0;
		for (int i = 0; i + 1 < n; i++)
			acc += m[order[i]][order[i + 1]];
		acc += m[order[n - 1]][order[0]];
		return acc;
	}

	public double tourLength(int[] order) {
		if (order.length != dm.length)
			throw new IllegalArgumentException("Tour has " + order.length + " cities, problem has " + dm.length);
		return tourLength(order, dm);
	}

	public double dist(int i, int j) {
		return dm[i][j];
	}

	public int numCities() {
		return cities.size();
	}

	public List<City> getCities() {
		return cities;
	}

	public City getCity(int idx) {
		return cities.get(idx);
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public Envelope getBounds() {
		return new Envelope(0, width, 0, height);
	}
}

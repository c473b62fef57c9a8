package salesman.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import salesman.utils.Rng;

class ProblemTest {

	static Problem square() {
		return Problem.build(Arrays.asList(new City(0, 0, 0), new City(0, 10, 1), new City(10, 10, 2), new City(10, 0, 3)), 20, 20);
	}

	@Test
	void distanceMatrixIsSymmetricWithZeroDiagonal() {
		Problem p = Problem.random(30, 100, 50, new Rng(3));
		for (int i = 0; i < p.numCities(); i++) {
			assertEquals(0.0, p.dist(i, i));
			for (int j = 0; j < p.numCities(); j++) {
				assertEquals(p.dist(i, j), p.dist(j, i));
				City a = p.getCity(i), b = p.getCity(j);
				assertEquals(Math.hypot(a.getX() - b.getX(), a.getY() - b.getY()), p.dist(i, j), 1e-9);
			}
		}
	}

	@Test
	void squarePerimeterIsForty() {
		Problem p = square();
		assertEquals(40.0, p.tourLength(new int[] { 0, 1, 2, 3 }), 1e-9);
		assertEquals(20 + 20 * Math.sqrt(2), p.tourLength(new int[] { 0, 2, 1, 3 }), 1e-9);
	}

	@Test
	@DisplayName("Tour length does not depend on rotation or direction of the cycle")
	void tourLengthInvariantUnderRotationAndReversal() {
		Rng rng = new Rng(11);
		for (int n = 3; n < 40; n += 3) {
			Problem p = Problem.random(n, 200, 200, rng);
			int[] order = Tour.random(n, rng).getOrder();
			double l = p.tourLength(order);

			for (int shift = 1; shift < n; shift++) {
				int[] rot = new int[n];
				for (int i = 0; i < n; i++)
					rot[i] = order[(i + shift) % n];
				assertEquals(l, p.tourLength(rot), 1e-9);
			}

			int[] rev = new int[n];
			for (int i = 0; i < n; i++)
				rev[i] = order[n - 1 - i];
			assertEquals(l, p.tourLength(rev), 1e-9);
		}
	}

	@Test
	void randomCitiesStayInBoundsAndAreTagged() {
		Problem p = Problem.random(500, 30, 20, new Rng(5));
		assertEquals(500, p.numCities());
		for (int i = 0; i < p.numCities(); i++) {
			City c = p.getCity(i);
			assertEquals(i, c.getTag());
			assertTrue(c.getX() >= 0 && c.getX() < 30);
			assertTrue(c.getY() >= 0 && c.getY() < 20);
		}
		assertEquals(30.0, p.getBounds().getWidth());
	}

	@Test
	void sameSeedSameCities() {
		assertEquals(Problem.random(20, 100, 100, new Rng(9)).getCities(), Problem.random(20, 100, 100, new Rng(9)).getCities());
	}

	@Test
	void buildCopiesCityList() {
		List<City> cities = new ArrayList<City>(Arrays.asList(new City(1, 1, 0), new City(2, 2, 1), new City(3, 3, 2)));
		Problem p = Problem.build(cities, 5, 5);
		cities.clear();
		assertEquals(3, p.numCities());
		assertThrows(UnsupportedOperationException.class, () -> p.getCities().clear());
	}

	@Test
	void invalidInputsAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> Problem.build(Collections.<City>emptyList(), 10, 10));
		assertThrows(IllegalArgumentException.class, () -> Problem.buildDistanceMatrix(Collections.<City>emptyList()));
		assertThrows(IllegalArgumentException.class, () -> Problem.build(Arrays.asList(new City(11, 0, 0)), 10, 10));
		assertThrows(IllegalArgumentException.class, () -> Problem.random(5, 0, 10, new Rng(1)));
		assertThrows(IllegalArgumentException.class, () -> square().tourLength(new int[] { 0, 1, 2 }));
	}

	@Test
	@DisplayName("Built cities must lie on the same grid that random cities are drawn from")
	void buildRejectsCitiesOnTheUpperEdge() {
		assertThrows(IllegalArgumentException.class, () -> Problem.build(Arrays.asList(new City(10, 0, 0)), 10, 10));
		assertThrows(IllegalArgumentException.class, () -> Problem.build(Arrays.asList(new City(0, 10, 0)), 10, 10));
		assertThrows(IllegalArgumentException.class, () -> Problem.build(Arrays.asList(new City(-1, 0, 0)), 10, 10));
		Problem p = Problem.build(Arrays.asList(new City(9, 9, 0), new City(0, 0, 1)), 10, 10);
		assertEquals(2, p.numCities());
	}

	@Test
	void buildRejectsTagsThatDoNotMatchTheirIndex() {
		assertThrows(IllegalArgumentException.class,
				() -> Problem.build(Arrays.asList(new City(1, 1, 1), new City(2, 2, 0)), 5, 5));
		assertThrows(IllegalArgumentException.class,
				() -> Problem.build(Arrays.asList(new City(1, 1, 0), new City(2, 2, 0)), 5, 5));
		assertThrows(IllegalArgumentException.class,
				() -> Problem.build(Arrays.asList(new City(1, 1, 0), new City(2, 2, 2)), 5, 5));
	}
}

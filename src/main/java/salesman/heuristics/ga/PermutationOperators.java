package salesman.heuristics.ga;

import java.util.ArrayList;
import java.util.List;

import salesman.problem.Tour;
import salesman.utils.Rng;

/**
 * Variation operators on tours that keep every child a permutation.
 */
public class PermutationOperators {

	private PermutationOperators() {
	}

	public static List<Tour> initPopulation(int populationSize, int numCities, Rng rng) {
		List<Tour> pop = new ArrayList<Tour>(populationSize);
		for (int i = 0; i < populationSize; i++)
			pop.add(Tour.random(numCities, rng));
		return pop;
	}

	/**
	 * Order crossover (OX). The slice [a,b] of the mother is kept in place, the
	 * remaining positions are filled from b+1 on (wrapping) with the father's
	 * genes in the order they appear in the father starting after b.
	 */
	public static Tour orderCrossover(Tour mother, Tour father, Rng rng) {
		int n = mother.size();
		if (father.size() != n)
			throw new IllegalArgumentException("Parents differ in size: " + n + " != " + father.size());

		int a = rng.randInt(0, n - 1);
		int b = rng.randInt(0, n - 1);
		if (a > b) {
			int tmp = a;
			a = b;
			b = tmp;
		}

		int[] child = new int[n];
		boolean[] taken = new boolean[n];
		for (int i = a; i <= b; i++) {
			child[i] = mother.get(i);
			taken[child[i]] = true;
		}

		int pos = (b + 1) % n;
		for (int i = 0; i < n; i++) {
			int gene = father.get((b + 1 + i) % n);
			if (!taken[gene]) {
				child[pos] = gene;
				pos = (pos + 1) % n;
			}
		}
		return new Tour(child);
	}

	public static void swapMutation(Tour t, double mutationRate, Rng rng) {
		int n = t.size();
		for (int i = 0; i < n; i++)
			if (rng.rand01() < mutationRate)
				t.swap(i, rng.randInt(0, n - 1));
	}
}

package salesman;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import salesman.heuristics.ProgressSink;
import salesman.heuristics.SteppableHeuristic;
import salesman.heuristics.ga.GAParams;
import salesman.heuristics.ga.GeneticAlgorithm;
import salesman.heuristics.sa.SAParams;
import salesman.heuristics.sa.SimulatedAnnealing;
import salesman.problem.Problem;
import salesman.problem.Tour;
import salesman.utils.Rng;

class StepDriverTest {

	@Test
	@DisplayName("Both heuristics run to completion side by side")
	void drivesHeuristicsUntilFinished() throws InterruptedException {
		Problem p = Problem.random(15, 100, 100, new Rng(1));
		GeneticAlgorithm ga = new GeneticAlgorithm(p, new GAParams(20, 40, 0.05, 2, 1, 1000), new Rng(2));
		SimulatedAnnealing sa = new SimulatedAnnealing(p, new SAParams(50, 1, 0.2, 10, 100000), new Rng(3));

		StepDriver d = new StepDriver(Arrays.asList(ga, sa), 1, 100000, 10);
		d.start();
		try {
			assertTrue(d.awaitCompletion(60, TimeUnit.SECONDS));
		} finally {
			d.shutdown();
		}
		assertNull(d.getFailure());
		assertTrue(ga.isFinished());
		assertTrue(sa.isFinished());
		assertEquals(40, ga.getGeneration());
	}

	@Test
	void stopsAfterMaxTicks() throws InterruptedException {
		Problem p = Problem.random(15, 100, 100, new Rng(4));
		GeneticAlgorithm ga = new GeneticAlgorithm(p, new GAParams(10, 100000, 0.05, 2, 1, 100000), new Rng(5));

		StepDriver d = new StepDriver(Collections.singletonList(ga), 1, 25, 1000);
		d.start();
		try {
			assertTrue(d.awaitCompletion(60, TimeUnit.SECONDS));
		} finally {
			d.shutdown();
		}
		assertEquals(25, ga.getGeneration());
	}

	@Test
	void failingStepEndsItsHeuristic() throws InterruptedException {
		RuntimeException boom = new IllegalStateException("boom");
		AtomicInteger calls = new AtomicInteger();
		SteppableHeuristic failing = new SteppableHeuristic() {
			@Override
			public String getName() {
				return "failing";
			}

			@Override
			public boolean step() {
				calls.incrementAndGet();
				throw boom;
			}

			@Override
			public boolean isFinished() {
				return false;
			}

			@Override
			public Tour getBestEver() {
				return Tour.identity(3);
			}

			@Override
			public long getProgress() {
				return 0;
			}

			@Override
			public void setProgressSink(ProgressSink sink) {
			}
		};

		StepDriver d = new StepDriver(Collections.singletonList(failing), 1, 1000, 1000);
		d.start();
		try {
			assertTrue(d.awaitCompletion(60, TimeUnit.SECONDS));
		} finally {
			d.shutdown();
		}
		assertSame(boom, d.getFailure());
		assertEquals(1, calls.get());
	}

	@Test
	@DisplayName("An Error thrown by a step still releases the driver")
	void erroringStepEndsItsHeuristic() throws InterruptedException {
		AssertionError boom = new AssertionError("boom");
		AtomicInteger calls = new AtomicInteger();
		SteppableHeuristic failing = new SteppableHeuristic() {
			@Override
			public String getName() {
				return "erroring";
			}

			@Override
			public boolean step() {
				calls.incrementAndGet();
				throw boom;
			}

			@Override
			public boolean isFinished() {
				return false;
			}

			@Override
			public Tour getBestEver() {
				return Tour.identity(3);
			}

			@Override
			public long getProgress() {
				return 0;
			}

			@Override
			public void setProgressSink(ProgressSink sink) {
			}
		};

		StepDriver d = new StepDriver(Collections.singletonList(failing), 1, 1000, 1000);
		d.start();
		try {
			assertTrue(d.awaitCompletion(60, TimeUnit.SECONDS));
		} finally {
			d.shutdown();
		}
		assertTrue(d.getFailure() instanceof IllegalStateException);
		assertSame(boom, d.getFailure().getCause());
		assertEquals(1, calls.get());
	}

	@Test
	@DisplayName("Readers never observe a tour in the middle of a step")
	void concurrentReadsSeeConsistentSnapshots() throws InterruptedException {
		Problem p = Problem.random(30, 100, 100, new Rng(6));
		GeneticAlgorithm ga = new GeneticAlgorithm(p, new GAParams(30, 300, 0.1, 2, 1, 1000), new Rng(7));
		SimulatedAnnealing sa = new SimulatedAnnealing(p, new SAParams(100, 0.01, 0.01, 20, 100000), new Rng(8));

		StepDriver d = new StepDriver(Arrays.asList(ga, sa), 1, 300, 1000);
		d.start();
		try {
			while (!d.awaitCompletion(1, TimeUnit.MILLISECONDS)) {
				for (Tour t : new Tour[] { ga.getCurrentBest(), ga.getBestEver(), sa.getCurrent(), sa.getBestEver() }) {
					assertTrue(t.isPermutation());
					assertEquals(p.tourLength(t.getOrder()), t.getLength(), 1e-9);
				}
			}
		} finally {
			d.shutdown();
		}
	}

	@Test
	void rejectsEmptyList() {
		assertThrows(IllegalArgumentException.class, () -> new StepDriver(Collections.<SteppableHeuristic>emptyList(), 1, 1, 1));
	}
}

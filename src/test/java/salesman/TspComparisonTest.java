package salesman;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import salesman.heuristics.ga.GAParams;
import salesman.heuristics.ga.GeneticAlgorithm;
import salesman.problem.Problem;
import salesman.problem.Tour;
import salesman.utils.CsvProgressLog;
import salesman.utils.Rng;

class TspComparisonTest {

	@TempDir
	Path tmp;

	private static Tour withLength(double l) {
		Tour t = Tour.identity(3);
		t.setValue(l);
		return t;
	}

	@Test
	void namesTheShorterTour() {
		assertEquals("SA is winning! GA: 120.0, SA: 100.5, difference: 19.5", TspComparison.compare(withLength(120), withLength(100.5)));
		assertEquals("GA is winning! GA: 90.0, SA: 100.0, difference: 10.0", TspComparison.compare(withLength(90), withLength(100)));
		assertEquals("Tie! GA: 40.0, SA: 40.0, difference: 0.0", TspComparison.compare(withLength(40), withLength(40)));
	}

	@Test
	@DisplayName("Interrupting a run stops the engines and keeps every record written so far")
	void shutdownHookStopsDriverAndClosesLog() throws Exception {
		File f = tmp.resolve("interrupted.csv").toFile();
		Problem p = Problem.random(20, 100, 100, new Rng(1));
		GeneticAlgorithm ga = new GeneticAlgorithm(p, new GAParams(20, 1000000, 0.05, 2, 1, 1000000), new Rng(2));
		CsvProgressLog csv = new CsvProgressLog(f);
		ga.setProgressSink(csv.sinkFor(ga.getName()));

		StepDriver d = new StepDriver(Collections.singletonList(ga), 1, Long.MAX_VALUE, 1000);
		d.start();
		long deadline = System.currentTimeMillis() + 60000;
		while (csv.getRecords() < 5 && System.currentTimeMillis() < deadline)
			Thread.sleep(5);

		TspComparison.closeOnShutdown(d, csv).run();
		assertTrue(d.awaitCompletion(1, TimeUnit.SECONDS));

		long records = csv.getRecords();
		assertTrue(records >= 5);
		List<String> lines = Files.readAllLines(f.toPath(), StandardCharsets.UTF_8);
		assertEquals(CsvProgressLog.HEADER, lines.get(0));
		assertEquals(records + 1, lines.size());
	}
}

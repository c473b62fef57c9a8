package salesman;

import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;

import org.apache.log4j.Logger;

import salesman.config.ConfigLoader;
import salesman.config.RunConfig;
import salesman.heuristics.ga.GeneticAlgorithm;
import salesman.heuristics.sa.SimulatedAnnealing;
import salesman.problem.Problem;
import salesman.problem.Tour;
import salesman.utils.ConfigurationException;
import salesman.utils.CsvProgressLog;
import salesman.utils.Rng;
import salesman.utils.TourExport;

/**
 * Runs the GA and SA side by side on the same random cities and reports which
 * one found the shorter tour.
 */
public class TspComparison {

	private static Logger log = Logger.getLogger(TspComparison.class);

	public static void main(String[] args) throws IOException, InterruptedException {
		RunConfig rc;
		try {
			rc = RunConfig.from(ConfigLoader.load());
		} catch (ConfigurationException e) {
			log.error(e.getMessage());
			System.exit(2);
			return;
		}

		Problem p = Problem.random(rc.getNumCities(), rc.getWidth(), rc.getHeight(), rng(rc.getCitySeed()));
		GeneticAlgorithm ga = new GeneticAlgorithm(p, rc.getGaParams(), rng(rc.getGaSeed()));
		SimulatedAnnealing sa = new SimulatedAnnealing(p, rc.getSaParams(), rng(rc.getSaSeed()));
		log.info(p.numCities() + " cities, " + ga.getParams() + ", " + sa.getParams());

		try (CsvProgressLog csv = new CsvProgressLog(CsvProgressLog.nextFreeFile(rc.getLogDir(), rc.getLogPrefix()))) {
			ga.setProgressSink(csv.sinkFor(ga.getName()));
			sa.setProgressSink(csv.sinkFor(sa.getName()));

			StepDriver driver = new StepDriver(Arrays.asList(ga, sa), rc.getTickMillis(), rc.getMaxTicks(), rc.getReportEveryTicks());
			Thread hook = closeOnShutdown(driver, csv);
			Runtime.getRuntime().addShutdownHook(hook);
			driver.start();
			try {
				driver.awaitCompletion();
			} finally {
				driver.shutdown();
			}
			Runtime.getRuntime().removeShutdownHook(hook);
			if (driver.getFailure() != null)
				throw driver.getFailure();
		}

		Tour gaBest = ga.getBestEver();
		Tour saBest = sa.getBestEver();
		log.info(compare(gaBest, saBest));
		log.info("GA best: " + TourExport.toWkt(p, gaBest));
		log.info("SA best: " + TourExport.toWkt(p, saBest));
	}

	// stops stepping before the log is closed, so an interrupted run keeps every record written so far
	public static Thread closeOnShutdown(StepDriver driver, CsvProgressLog csv) {
		return new Thread(() -> {
			driver.shutdown();
			try {
				csv.close();
			} catch (IOException e) {
				log.error("Cannot close progress log", e);
			}
		}, "salesman-shutdown");
	}

	public static String compare(Tour gaBest, Tour saBest) {
		double diff = Math.abs(saBest.getLength() - gaBest.getLength());
		String winner;
		if (saBest.getLength() < gaBest.getLength())
			winner = "SA is winning!";
		else if (gaBest.getLength() < saBest.getLength())
			winner = "GA is winning!";
		else
			winner = "Tie!";
		return winner + " GA: " + String.format(Locale.ROOT, "%.1f", gaBest.getLength()) + ", SA: " + String.format(Locale.ROOT, "%.1f", saBest.getLength())
				+ ", difference: " + String.format(Locale.ROOT, "%.1f", diff);
	}

	private static Rng rng(Long seed) {
		return seed == null ? new Rng() : new Rng(seed);
	}
}

package salesman.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import salesman.heuristics.ga.GAParams;
import salesman.heuristics.sa.GeometricCooling;
import salesman.heuristics.sa.SAParams;
import salesman.utils.ConfigurationException;

/**
 * Everything a comparison run needs, read from the salesman block of a
 * {@link Config}. GA and SA keys that are left out take the defaults scaled
 * with the number of cities.
 */
public final class RunConfig {

	private final int numCities, width, height;
	private final Long citySeed, gaSeed, saSeed;
	private final GAParams gaParams;
	private final SAParams saParams;
	private final long tickMillis;
	private final long maxTicks;
	private final int reportEveryTicks;
	private final File logDir;
	private final String logPrefix;

	private RunConfig(Config c) {
		Config cities = c.getConfig("cities");
		numCities = cities.getInt("count");
		width = cities.getInt("width");
		height = cities.getInt("height");
		citySeed = optLong(cities, "seed");
		ConfigurationException.require(numCities >= 3, "Need at least 3 cities, got " + numCities);
		ConfigurationException.require(width > 0 && height > 0, "Bounds must be positive: " + width + "x" + height);

		gaParams = readGA(c.hasPath("ga") ? c.getConfig("ga") : null, GAParams.forCities(numCities)).validate();
		saParams = readSA(c.hasPath("sa") ? c.getConfig("sa") : null, SAParams.forCities(numCities)).validate();

		Config run = c.getConfig("run");
		tickMillis = run.getLong("tick-millis");
		maxTicks = run.getLong("max-ticks");
		reportEveryTicks = run.getInt("report-every-ticks");
		logDir = new File(run.getString("log-dir"));
		logPrefix = run.getString("log-prefix");
		gaSeed = optLong(run, "ga-seed");
		saSeed = optLong(run, "sa-seed");
		ConfigurationException.require(tickMillis >= 1, "tick-millis must be >= 1: " + tickMillis);
		ConfigurationException.require(maxTicks >= 1, "max-ticks must be >= 1: " + maxTicks);
		ConfigurationException.require(reportEveryTicks >= 1, "report-every-ticks must be >= 1: " + reportEveryTicks);
	}

	public static RunConfig from(Config config) {
		try {
			return new RunConfig(config.getConfig("salesman"));
		} catch (ConfigException e) {
			throw new ConfigurationException("Invalid run configuration: " + e.getMessage(), e);
		}
	}

	private static GAParams readGA(Config c, GAParams p) {
		if (c == null)
			return p;
		if (c.hasPath("population-size"))
			p = p.withPopulationSize(c.getInt("population-size"));
		if (c.hasPath("generations"))
			p = p.withGenerations(c.getInt("generations"));
		if (c.hasPath("mutation-rate"))
			p = p.withMutationRate(c.getDouble("mutation-rate"));
		if (c.hasPath("tournament-k"))
			p = p.withTournamentK(c.getInt("tournament-k"));
		if (c.hasPath("elitism"))
			p = p.withElitism(c.getInt("elitism"));
		if (c.hasPath("stall-limit"))
			p = p.withStallLimit(c.getInt("stall-limit"));
		return p;
	}

	private static SAParams readSA(Config c, SAParams p) {
		if (c == null)
			return p;
		double initialTemp = c.hasPath("initial-temp") ? c.getDouble("initial-temp") : p.getInitialTemp();
		double finalTemp = c.hasPath("final-temp") ? c.getDouble("final-temp") : p.getFinalTemp();
		double alpha = c.hasPath("alpha") ? c.getDouble("alpha") : p.getAlpha();
		int neighbors = c.hasPath("neighbors-per-temp") ? c.getInt("neighbors-per-temp") : p.getNeighborsPerTemp();
		int stallLimit = c.hasPath("stall-limit") ? c.getInt("stall-limit") : p.getStallLimit();

		SAParams sa = new SAParams(initialTemp, finalTemp, alpha, neighbors, stallLimit);
		if (c.hasPath("geometric-rate"))
			sa = sa.withCooling(new GeometricCooling(c.getDouble("geometric-rate")));
		return sa;
	}

	private static Long optLong(Config c, String path) {
		return c.hasPath(path) ? Long.valueOf(c.getLong(path)) : null;
	}

	public int getNumCities() {
		return numCities;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	// null means seeded from the clock
	public Long getCitySeed() {
		return citySeed;
	}

	public Long getGaSeed() {
		return gaSeed;
	}

	public Long getSaSeed() {
		return saSeed;
	}

	public GAParams getGaParams() {
		return gaParams;
	}

	public SAParams getSaParams() {
		return saParams;
	}

	public long getTickMillis() {
		return tickMillis;
	}

	public long getMaxTicks() {
		return maxTicks;
	}

	public int getReportEveryTicks() {
		return reportEveryTicks;
	}

	public File getLogDir() {
		return logDir;
	}

	public String getLogPrefix() {
		return logPrefix;
	}
}

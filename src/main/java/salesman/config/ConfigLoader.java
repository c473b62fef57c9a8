package salesman.config;

import java.io.File;

import org.apache.log4j.Logger;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the run configuration. Precedence, highest first: system properties
 * (-Dsalesman.cities.count=100), salesman.conf in the working directory, the
 * given classpath resource, reference.conf.
 */
public final class ConfigLoader {

	private static Logger log = Logger.getLogger(ConfigLoader.class);

	public static final String CONFIG_FILE_NAME = "salesman.conf";

	private ConfigLoader() {
	}

	public static Config load() {
		return load(null);
	}

	public static Config load(String resource) {
		Config cliConfig = ConfigFactory.systemProperties();

		File configFile = new File(CONFIG_FILE_NAME);
		Config fileConfig;
		if (configFile.isFile()) {
			log.info("Loading configuration from " + configFile.getAbsolutePath());
			fileConfig = ConfigFactory.parseFile(configFile);
		} else
			fileConfig = ConfigFactory.empty();

		Config resourceConfig = resource == null ? ConfigFactory.empty() : ConfigFactory.parseResources(resource);

		return cliConfig
				.withFallback(fileConfig)
				.withFallback(resourceConfig)
				.withFallback(ConfigFactory.parseResources("reference.conf"))
				.resolve();
	}
}

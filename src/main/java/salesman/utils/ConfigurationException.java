package salesman.utils;

/**
 * Thrown when a heuristic or a run is set up with parameters it cannot work
 * with. Only the failing initialization is affected, it can be retried with
 * corrected values.
 */
public class ConfigurationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

	public static void require(boolean condition, String message) {
		if (!condition)
			throw new ConfigurationException(message);
	}
}

package salesman.heuristics;

/**
 * Receives one record per executed step of a heuristic. Implementations are
 * supplied by whoever drives the heuristics (a file log, a test recorder, ...).
 */
public interface ProgressSink {

	public static final ProgressSink NONE = (step, bestLength) -> {
	};

	public void append(long step, double bestLength);
}

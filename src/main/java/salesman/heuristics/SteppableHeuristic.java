package salesman.heuristics;

import salesman.problem.Tour;

/**
 * A search that advances in bounded units of work. One call to
 * {@link #step()} performs one generation or epoch and returns. Calls must not
 * overlap on the same instance, accessors may be used from other threads.
 */
public interface SteppableHeuristic {

	public String getName();

	/**
	 * @return false if the heuristic is finished, either before or because of this call
	 */
	public boolean step();

	public boolean isFinished();

	public Tour getBestEver();

	// generation for the GA, cumulative iterations for SA
	public long getProgress();

	public void setProgressSink(ProgressSink sink);
}

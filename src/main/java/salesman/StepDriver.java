package salesman;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.log4j.Logger;

import salesman.heuristics.SteppableHeuristic;

/**
 * Paces heuristics with a fixed tick: every tick each unfinished heuristic
 * gets one step() on its own scheduled task. A reporter task reads the
 * heuristics concurrently and logs their progress. The driver completes when
 * every heuristic finished or used up maxTicks steps.
 */
public class StepDriver {

	private static Logger log = Logger.getLogger(StepDriver.class);

	private final List<Worker> workers = new ArrayList<Worker>();
	private final long tickMillis;
	private final long maxTicks;
	private final int reportEveryTicks;
	private final ScheduledExecutorService ses;
	private final CountDownLatch done;
	private volatile RuntimeException failure;
	private ScheduledFuture<?> reporter;

	private class Worker implements Runnable {
		final SteppableHeuristic h;
		final AtomicBoolean finished = new AtomicBoolean(false);
		volatile ScheduledFuture<?> future;
		long ticks = 0;

		Worker(SteppableHeuristic h) {
			this.h = h;
		}

		@Override
		public void run() {
			if (finished.get()) {
				cancel();
				return;
			}
			boolean running;
			try {
				running = h.step();
			} catch (RuntimeException e) {
				log.error(h.getName() + " failed in step " + ticks, e);
				failure = e;
				running = false;
			} catch (Error e) {
				log.error(h.getName() + " failed in step " + ticks, e);
				failure = new IllegalStateException(h.getName() + " failed in step " + ticks + ": " + e, e);
				finish();
				throw e;
			}
			if (!running || ++ticks >= maxTicks)
				finish();
		}

		void finish() {
			if (finished.compareAndSet(false, true)) {
				log.debug(h.getName() + " done after " + ticks + " ticks");
				cancel();
				done.countDown();
			}
		}

		void cancel() {
			ScheduledFuture<?> f = future;
			if (f != null)
				f.cancel(false);
		}
	}

	public StepDriver(List<? extends SteppableHeuristic> heuristics, long tickMillis, long maxTicks, int reportEveryTicks) {
		if (heuristics.isEmpty())
			throw new IllegalArgumentException("Nothing to drive!");
		for (SteppableHeuristic h : heuristics)
			workers.add(new Worker(h));
		this.tickMillis = tickMillis;
		this.maxTicks = maxTicks;
		this.reportEveryTicks = reportEveryTicks;
		this.ses = Executors.newScheduledThreadPool(workers.size() + 1);
		this.done = new CountDownLatch(workers.size());
	}

	public synchronized void start() {
		for (Worker w : workers)
			w.future = ses.scheduleAtFixedRate(w, 0, tickMillis, TimeUnit.MILLISECONDS);
		long reportMillis = tickMillis * reportEveryTicks;
		reporter = ses.scheduleAtFixedRate(this::report, reportMillis, reportMillis, TimeUnit.MILLISECONDS);
	}

	public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
		return done.await(timeout, unit);
	}

	public void awaitCompletion() throws InterruptedException {
		done.await();
	}

	public void report() {
		for (Worker w : workers) {
			SteppableHeuristic h = w.h;
			log.info(h.getName() + ": step " + h.getProgress() + ", best " + h.getBestEver().getLength() + (h.isFinished() ? ", finished" : ""));
		}
	}

	public synchronized void shutdown() {
		if (reporter != null)
			reporter.cancel(false);
		for (Worker w : workers)
			w.finish();
		ses.shutdown();
		try {
			if (!ses.awaitTermination(10, TimeUnit.SECONDS))
				ses.shutdownNow();
		} catch (InterruptedException e) {
			ses.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	public RuntimeException getFailure() {
		return failure;
	}
}

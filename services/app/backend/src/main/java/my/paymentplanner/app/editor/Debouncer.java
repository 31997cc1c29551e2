package my.paymentplanner.app.editor;

import java.time.Duration;

/**
 * Keeps at most one pending task. Submitting again cancels the task still waiting.
 */
public class Debouncer {
	private final RecomputeScheduler scheduler;
	private final Duration delay;
	private RecomputeScheduler.ScheduledTask pending;
	private long generation;

	public Debouncer(RecomputeScheduler scheduler, Duration delay) {
		this.scheduler = scheduler;
		this.delay = delay == null ? Duration.ZERO : delay;
	}

	public synchronized void submit(Runnable task) {
		cancel();
		long submitted = ++generation;
		pending = scheduler.schedule(() -> {
			if (claim(submitted)) {
				task.run();
			}
		}, delay);
	}

	public synchronized void cancel() {
		generation++;
		if (pending != null) {
			pending.cancel();
			pending = null;
		}
	}

	public synchronized boolean isPending() {
		return pending != null;
	}

	private synchronized boolean claim(long submitted) {
		if (submitted != generation) {
			return false;
		}
		pending = null;
		return true;
	}
}

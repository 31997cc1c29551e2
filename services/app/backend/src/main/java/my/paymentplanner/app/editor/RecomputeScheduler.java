package my.paymentplanner.app.editor;

import java.time.Duration;

/**
 * Runs a task once after a delay. The returned handle cancels it if it has not started yet.
 */
public interface RecomputeScheduler {

	ScheduledTask schedule(Runnable task, Duration delay);

	interface ScheduledTask {
		void cancel();
	}
}

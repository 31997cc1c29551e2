package my.paymentplanner.app.editor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public class ExecutorRecomputeScheduler implements RecomputeScheduler {
	private static final Logger logger = LoggerFactory.getLogger(ExecutorRecomputeScheduler.class);

	private final ScheduledExecutorService executor;

	public ExecutorRecomputeScheduler() {
		this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "plan-editor-timer");
			thread.setDaemon(true);
			return thread;
		});
	}

	@Override
	public ScheduledTask schedule(Runnable task, Duration delay) {
		ScheduledFuture<?> future = executor.schedule(() -> {
			try {
				task.run();
			} catch (RuntimeException ex) {
				logger.warn("Scheduled editor task failed: {}", ex.getMessage(), ex);
			}
		}, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
		return () -> future.cancel(false);
	}

	public void shutdown() {
		executor.shutdownNow();
	}
}

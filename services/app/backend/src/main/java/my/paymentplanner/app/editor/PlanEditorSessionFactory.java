package my.paymentplanner.app.editor;

import jakarta.annotation.PreDestroy;
import my.paymentplanner.app.config.AppProperties;
import my.paymentplanner.app.service.EditabilityPolicy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Opens editor sessions. All sessions share one event-loop thread, so outcomes are applied one
 * at a time.
 */
@Component
public class PlanEditorSessionFactory {
	private static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(250);

	private final PlanEditorGateway gateway;
	private final EditabilityPolicy editabilityPolicy;
	private final RecomputeScheduler scheduler;
	private final Duration debounceDelay;
	private final Clock clock;
	private final ExecutorService eventLoop = Executors.newSingleThreadExecutor(runnable -> {
		Thread thread = new Thread(runnable, "plan-editor-events");
		thread.setDaemon(true);
		return thread;
	});

	public PlanEditorSessionFactory(PlanEditorGateway gateway,
	                                EditabilityPolicy editabilityPolicy,
	                                RecomputeScheduler scheduler,
	                                AppProperties properties,
	                                Clock clock) {
		this.gateway = gateway;
		this.editabilityPolicy = editabilityPolicy;
		this.scheduler = scheduler;
		Duration configured = properties.planEditor() == null ? null : properties.planEditor().debounceDelay();
		this.debounceDelay = configured == null ? DEFAULT_DEBOUNCE : configured;
		this.clock = clock;
	}

	public PlanEditorSession open(String caseId, EditorListener listener) {
		if (caseId == null || caseId.isBlank()) {
			throw new IllegalArgumentException("Case id is required");
		}
		return new PlanEditorSession(caseId.trim(), gateway, new InteractiveGridController(editabilityPolicy), scheduler,
				debounceDelay, eventLoop, listener, clock);
	}

	public Duration debounceDelay() {
		return debounceDelay;
	}

	@PreDestroy
	public void shutdown() {
		eventLoop.shutdownNow();
	}
}

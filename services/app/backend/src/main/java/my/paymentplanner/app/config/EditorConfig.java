package my.paymentplanner.app.config;

import my.paymentplanner.app.editor.ExecutorRecomputeScheduler;
import my.paymentplanner.app.service.EditabilityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EditorConfig {
	private static final Logger logger = LoggerFactory.getLogger(EditorConfig.class);

	@Bean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public EditabilityPolicy editabilityPolicy(AppProperties properties) {
		boolean activeEditable = properties.planEditor() != null && properties.planEditor().activeScheduledRowsEditable();
		logger.info("Scheduled rows of active plan versions are {}", activeEditable ? "editable" : "read-only");
		return new EditabilityPolicy(activeEditable);
	}

	@Bean(destroyMethod = "shutdown")
	public ExecutorRecomputeScheduler recomputeScheduler() {
		return new ExecutorRecomputeScheduler();
	}
}

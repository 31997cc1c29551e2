package my.paymentplanner.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import my.paymentplanner.app.domain.ProgramType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Externally supplied settings. The plan policy has no code defaults: a missing value is
 * reported when a calculation needs it, see {@code PlanPolicyService}.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid PlanPolicy planPolicy,
		@Valid PlanEditor planEditor
) {
	public record PlanPolicy(
			@Positive BigDecimal weeklyToMonthlyFactor,
			@Positive Integer minProgramWeeks,
			@Positive Integer maxProgramWeeks,
			@PositiveOrZero BigDecimal noFeeSetupFee,
			Map<String, BigDecimal> additionalProducts,
			List<String> wireFeeTypes,
			Map<ProgramType, @Valid ProgramPolicy> programs
	) {
	}

	public record ProgramPolicy(
			@PositiveOrZero BigDecimal settlementPercent,
			@PositiveOrZero BigDecimal programFeePercent,
			@PositiveOrZero BigDecimal bankingFee,
			@PositiveOrZero BigDecimal secondaryBankingFee,
			@PositiveOrZero BigDecimal programSplitRatio,
			@PositiveOrZero BigDecimal escrowSplitRatio,
			@PositiveOrZero BigDecimal minWeeklyTarget,
			@PositiveOrZero BigDecimal minPercent,
			@PositiveOrZero BigDecimal maxPercent,
			@PositiveOrZero BigDecimal setupFee,
			@Positive Integer setupFeeMinPayments,
			@Positive Integer setupFeeMaxPayments
	) {
	}

	public record PlanEditor(
			boolean activeScheduledRowsEditable,
			Duration debounceDelay
	) {
	}
}

package my.paymentplanner.app.service;

import my.paymentplanner.app.config.AppProperties;
import my.paymentplanner.app.domain.CalculationMode;
import my.paymentplanner.app.domain.PaymentFrequency;
import my.paymentplanner.app.domain.ProgramType;
import my.paymentplanner.app.dto.PlanRequest;
import my.paymentplanner.app.error.ConfigurationUnavailableException;
import my.paymentplanner.app.error.PlanValidationException;
import my.paymentplanner.app.model.PaymentBounds;
import my.paymentplanner.app.model.PlanConfiguration;
import my.paymentplanner.app.model.SetupFee;
import my.paymentplanner.app.service.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves calculation requests against the externally supplied plan policy. Nothing here falls
 * back to built-in values: an incomplete policy stops every calculation with
 * {@link ConfigurationUnavailableException}.
 */
@Service
public class PlanPolicyService {
	private static final Logger logger = LoggerFactory.getLogger(PlanPolicyService.class);

	private final AppProperties properties;
	private final Clock clock;

	public PlanPolicyService(AppProperties properties, Clock clock) {
		this.properties = properties;
		this.clock = clock;
	}

	public AppProperties.PlanPolicy requirePolicy() {
		AppProperties.PlanPolicy policy = properties == null ? null : properties.planPolicy();
		if (policy == null) {
			throw unavailable("Plan policy is not configured");
		}
		if (policy.weeklyToMonthlyFactor() == null || policy.minProgramWeeks() == null || policy.maxProgramWeeks() == null) {
			throw unavailable("Plan policy is missing the frequency factor or program week range");
		}
		return policy;
	}

	public AppProperties.ProgramPolicy requireProgram(ProgramType programType) {
		AppProperties.PlanPolicy policy = requirePolicy();
		AppProperties.ProgramPolicy program = policy.programs() == null ? null : policy.programs().get(programType);
		if (program == null) {
			throw unavailable("No policy configured for program type " + programType);
		}
		if (program.settlementPercent() == null
				|| program.programFeePercent() == null
				|| program.bankingFee() == null
				|| program.programSplitRatio() == null
				|| program.escrowSplitRatio() == null
				|| program.minWeeklyTarget() == null
				|| program.minPercent() == null
				|| program.maxPercent() == null
				|| program.setupFee() == null
				|| program.setupFeeMinPayments() == null
				|| program.setupFeeMaxPayments() == null) {
			throw unavailable("Policy for program type " + programType + " is incomplete");
		}
		return program;
	}

	public PlanConfiguration resolve(PlanRequest request) {
		if (request == null) {
			throw new PlanValidationException("plan", "Plan parameters are required");
		}
		if (request.programType() == null) {
			throw new PlanValidationException("programType", "Select a program type");
		}
		if (request.calculationMode() == null) {
			throw new PlanValidationException("calculationMode", "Select a calculation mode");
		}
		if (!Money.isPositive(request.totalDebt())) {
			throw new PlanValidationException("totalDebt", "Total enrolled debt must be greater than zero");
		}
		ProgramType programType = request.programType();
		AppProperties.PlanPolicy policy = requirePolicy();
		AppProperties.ProgramPolicy program = requireProgram(programType);
		boolean noFee = programType.impliesNoFee() || Boolean.TRUE.equals(request.noFeeProgram());

		int setupPayments = request.setupFeeNumberOfPayments() == null
				? program.setupFeeMinPayments()
				: request.setupFeeNumberOfPayments();
		if (setupPayments < program.setupFeeMinPayments() || setupPayments > program.setupFeeMaxPayments()) {
			int bound = setupPayments < program.setupFeeMinPayments()
					? program.setupFeeMinPayments()
					: program.setupFeeMaxPayments();
			throw new PlanValidationException("setupFeeNumberOfPayments", BigDecimal.valueOf(setupPayments),
					BigDecimal.valueOf(bound), "Setup fee payments must be between "
					+ program.setupFeeMinPayments() + " and " + program.setupFeeMaxPayments());
		}
		BigDecimal setupTotal = request.setupFeeTotal();
		if (setupTotal == null) {
			setupTotal = noFee ? policy.noFeeSetupFee() : program.setupFee();
			if (setupTotal == null) {
				throw unavailable("No-fee setup fee is not configured");
			}
		}

		List<String> products = request.additionalProducts() == null ? List.of() : request.additionalProducts();
		BigDecimal productsTotal = additionalProductsTotal(policy, products);

		DayOfWeek weekday = request.preferredWeekday();
		if (weekday == DayOfWeek.SATURDAY || weekday == DayOfWeek.SUNDAY) {
			throw new PlanValidationException("preferredWeekday", "Payments can only be drafted Monday to Friday");
		}
		LocalDate firstPaymentDate = request.firstPaymentDate() == null
				? defaultFirstPaymentDate()
				: request.firstPaymentDate();
		PaymentFrequency frequency = request.paymentFrequency() == null
				? PaymentFrequency.WEEKLY
				: request.paymentFrequency();
		CalculationMode mode = request.calculationMode();

		return new PlanConfiguration(
				programType,
				frequency,
				mode,
				request.targetPercent(),
				request.targetAmount(),
				request.targetPeriods(),
				new SetupFee(Money.round(setupTotal), setupPayments),
				Money.round(program.bankingFee()),
				Money.round(program.secondaryBankingFee()),
				noFee ? BigDecimal.ZERO : program.programSplitRatio(),
				noFee ? BigDecimal.ONE : program.escrowSplitRatio(),
				firstPaymentDate,
				weekday,
				noFee,
				products,
				productsTotal,
				new PaymentBounds(program.minWeeklyTarget(), program.minPercent(), program.maxPercent()),
				program.settlementPercent(),
				program.programFeePercent(),
				policy.weeklyToMonthlyFactor(),
				policy.minProgramWeeks(),
				policy.maxProgramWeeks()
		);
	}

	/**
	 * The Monday after today.
	 */
	public LocalDate defaultFirstPaymentDate() {
		return LocalDate.now(clock).with(TemporalAdjusters.next(DayOfWeek.MONDAY));
	}

	public List<String> wireFeeTypes() {
		List<String> types = requirePolicy().wireFeeTypes();
		if (types == null || types.isEmpty()) {
			throw unavailable("Wire fee types are not configured");
		}
		return List.copyOf(types);
	}

	private BigDecimal additionalProductsTotal(AppProperties.PlanPolicy policy, List<String> products) {
		if (products.isEmpty()) {
			return Money.ZERO;
		}
		Map<String, BigDecimal> catalog = policy.additionalProducts() == null ? Map.of() : policy.additionalProducts();
		List<String> unknown = new ArrayList<>();
		BigDecimal total = Money.ZERO;
		for (String code : products) {
			BigDecimal fee = catalog.get(code);
			if (fee == null) {
				unknown.add(code);
				continue;
			}
			total = total.add(fee);
		}
		if (!unknown.isEmpty()) {
			throw new PlanValidationException("additionalProducts", "Unknown additional products: " + unknown);
		}
		return Money.round(total);
	}

	private ConfigurationUnavailableException unavailable(String message) {
		logger.error("Plan calculation disabled: {}", message);
		return new ConfigurationUnavailableException(message);
	}
}

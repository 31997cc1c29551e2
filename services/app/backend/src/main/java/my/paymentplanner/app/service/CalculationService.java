package my.paymentplanner.app.service;

import my.paymentplanner.app.dto.PlanRequest;
import my.paymentplanner.app.error.PlanValidationException;
import my.paymentplanner.app.model.AmountEstimate;
import my.paymentplanner.app.model.DurationEstimate;
import my.paymentplanner.app.model.PlanConfiguration;
import my.paymentplanner.app.model.PlanTotals;
import my.paymentplanner.app.model.ScheduleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

@Service
public class CalculationService {
	private static final Logger logger = LoggerFactory.getLogger(CalculationService.class);

	private final PlanPolicyService planPolicyService;
	private final ScheduleCalculator scheduleCalculator;

	public CalculationService(PlanPolicyService planPolicyService, ScheduleCalculator scheduleCalculator) {
		this.planPolicyService = planPolicyService;
		this.scheduleCalculator = scheduleCalculator;
	}

	public ScheduleResult calculate(PlanRequest request) {
		PlanConfiguration configuration = planPolicyService.resolve(request);
		return calculate(configuration, request.totals());
	}

	public ScheduleResult calculate(PlanConfiguration configuration, PlanTotals totals) {
		ScheduleResult result = scheduleCalculator.calculate(configuration, totals);
		logger.debug("Calculated {} {} payments of {} for program {}", result.summary().numberOfPeriods(),
				configuration.paymentFrequency(), result.summary().periodPayment(), configuration.programType());
		return result;
	}

	public DurationEstimate durationFromAmount(PlanRequest request, BigDecimal periodPayment) {
		if (periodPayment == null) {
			throw new PlanValidationException("periodPayment", "Enter a valid payment amount");
		}
		return scheduleCalculator.durationFromAmount(planPolicyService.resolve(request), request.totals(), periodPayment);
	}

	public AmountEstimate amountFromDuration(PlanRequest request, Integer numberOfPeriods) {
		if (numberOfPeriods == null) {
			throw new PlanValidationException("numberOfPeriods", "Enter the desired number of payments");
		}
		return scheduleCalculator.amountFromDuration(planPolicyService.resolve(request), request.totals(), numberOfPeriods);
	}
}

package my.paymentplanner.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.paymentplanner.app.dto.AmountRequest;
import my.paymentplanner.app.dto.DurationRequest;
import my.paymentplanner.app.dto.PlanRequest;
import my.paymentplanner.app.model.AmountEstimate;
import my.paymentplanner.app.model.DurationEstimate;
import my.paymentplanner.app.model.ScheduleResult;
import my.paymentplanner.app.service.CalculationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/calculations")
@Tag(name = "Calculations")
public class PlanCalculationController {
	private final CalculationService calculationService;

	public PlanCalculationController(CalculationService calculationService) {
		this.calculationService = calculationService;
	}

	@PostMapping
	@Operation(summary = "Calculate a payment schedule without saving it")
	public ScheduleResult calculate(@Valid @RequestBody PlanRequest request) {
		return calculationService.calculate(request);
	}

	@PostMapping("/duration")
	@Operation(summary = "Number of payments needed for a per-period payment")
	public DurationEstimate duration(@Valid @RequestBody DurationRequest request) {
		return calculationService.durationFromAmount(request.plan(), request.periodPayment());
	}

	@PostMapping("/amount")
	@Operation(summary = "Per-period payment needed to finish in a number of payments")
	public AmountEstimate amount(@Valid @RequestBody AmountRequest request) {
		return calculationService.amountFromDuration(request.plan(), request.numberOfPeriods());
	}
}

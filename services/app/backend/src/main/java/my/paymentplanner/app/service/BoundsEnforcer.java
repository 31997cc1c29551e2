package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.PaymentFrequency;
import my.paymentplanner.app.error.PlanValidationException;
import my.paymentplanner.app.model.BoundedAmount;
import my.paymentplanner.app.model.PaymentBounds;
import my.paymentplanner.app.service.util.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Keeps target payments inside the program bounds. All checks run in weekly space; monthly
 * figures are converted with the configured weekly-to-monthly factor first.
 */
@Component
public class BoundsEnforcer {

	public BoundedAmount clampPercent(BigDecimal percent, PaymentBounds bounds) {
		BigDecimal min = bounds.minPercent();
		BigDecimal max = bounds.maxPercent();
		if (percent == null) {
			return new BoundedAmount(null, min);
		}
		BigDecimal applied = percent;
		if (min != null && applied.compareTo(min) < 0) {
			applied = min;
		}
		if (max != null && applied.compareTo(max) > 0) {
			applied = max;
		}
		return new BoundedAmount(percent, applied);
	}

	/**
	 * The larger of the program's absolute minimum and the percent floor. The percent floor only
	 * applies when the current payment is known.
	 */
	public BigDecimal weeklyFloor(PaymentBounds bounds, BigDecimal currentPayment) {
		BigDecimal absolute = Money.round(bounds.minWeeklyTarget());
		if (!Money.isPositive(currentPayment) || bounds.minPercent() == null) {
			return absolute;
		}
		BigDecimal percentFloor = Money.percentOf(currentPayment, bounds.minPercent());
		return absolute.max(percentFloor);
	}

	public Optional<BigDecimal> weeklyCeiling(PaymentBounds bounds, BigDecimal currentPayment) {
		if (!Money.isPositive(currentPayment) || bounds.maxPercent() == null) {
			return Optional.empty();
		}
		return Optional.of(Money.percentOf(currentPayment, bounds.maxPercent()));
	}

	/**
	 * Weekly target from a percent of the current payment: the percent is clamped first, then the
	 * resulting amount is lifted to the weekly floor.
	 */
	public BoundedAmount weeklyTargetFromPercent(BigDecimal percent, BigDecimal currentPayment, PaymentBounds bounds) {
		if (!Money.isPositive(currentPayment)) {
			throw new PlanValidationException("currentPayment",
					"A current payment is required to calculate from a percent");
		}
		BoundedAmount clampedPercent = clampPercent(percent, bounds);
		BigDecimal weekly = Money.percentOf(currentPayment, clampedPercent.applied());
		BigDecimal floor = weeklyFloor(bounds, currentPayment);
		return new BoundedAmount(weekly, weekly.max(floor));
	}

	/**
	 * Rejects a desired weekly amount outside the bounds. Amounts within one cent of a bound are
	 * accepted; nothing is corrected.
	 */
	public void validateDesiredWeekly(BigDecimal weekly, PaymentBounds bounds, BigDecimal currentPayment) {
		if (weekly == null || weekly.signum() <= 0) {
			throw new PlanValidationException("targetAmount", "Enter a valid payment amount");
		}
		BigDecimal amount = Money.round(weekly);
		BigDecimal floor = weeklyFloor(bounds, currentPayment);
		if (amount.add(Money.CENT).compareTo(floor) < 0) {
			throw new PlanValidationException("targetAmount", amount, floor,
					"Payment must be at least " + floor + " per week");
		}
		Optional<BigDecimal> ceiling = weeklyCeiling(bounds, currentPayment);
		if (ceiling.isPresent() && amount.subtract(Money.CENT).compareTo(ceiling.get()) > 0) {
			throw new PlanValidationException("targetAmount", amount, ceiling.get(),
					"Payment cannot exceed " + ceiling.get() + " per week");
		}
	}

	public BigDecimal toWeekly(BigDecimal amount, PaymentFrequency frequency, BigDecimal weeklyToMonthlyFactor) {
		if (amount == null) {
			return null;
		}
		if (frequency == PaymentFrequency.MONTHLY) {
			return Money.round(amount.divide(weeklyToMonthlyFactor, 10, RoundingMode.HALF_UP));
		}
		return Money.round(amount);
	}

	public BigDecimal toDisplay(BigDecimal weekly, PaymentFrequency frequency, BigDecimal weeklyToMonthlyFactor) {
		if (weekly == null) {
			return null;
		}
		if (frequency == PaymentFrequency.MONTHLY) {
			return Money.round(weekly.multiply(weeklyToMonthlyFactor));
		}
		return Money.round(weekly);
	}
}

package my.paymentplanner.app.service.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Money {
	public static final int SCALE = 2;
	public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
	public static final BigDecimal CENT = new BigDecimal("0.01");
	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	private Money() {
	}

	public static BigDecimal round(BigDecimal value) {
		if (value == null) {
			return ZERO;
		}
		return value.setScale(SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal orZero(BigDecimal value) {
		return value == null ? ZERO : value;
	}

	public static BigDecimal percentOf(BigDecimal base, BigDecimal percent) {
		return round(orZero(base).multiply(orZero(percent)).divide(HUNDRED, 10, RoundingMode.HALF_UP));
	}

	public static BigDecimal asPercent(BigDecimal part, BigDecimal whole) {
		if (whole == null || whole.signum() == 0) {
			return ZERO;
		}
		return round(orZero(part).multiply(HUNDRED).divide(whole, 10, RoundingMode.HALF_UP));
	}

	public static BigDecimal divide(BigDecimal value, BigDecimal divisor) {
		return round(orZero(value).divide(divisor, 10, RoundingMode.HALF_UP));
	}

	/**
	 * Divides and rounds up to the cent, so {@code divisor} payments of the result cover {@code value}.
	 */
	public static BigDecimal divideUp(BigDecimal value, BigDecimal divisor) {
		return orZero(value).divide(divisor, SCALE, RoundingMode.CEILING);
	}

	public static BigDecimal sum(BigDecimal... values) {
		BigDecimal total = ZERO;
		for (BigDecimal value : values) {
			total = total.add(orZero(value));
		}
		return round(total);
	}

	public static boolean isPositive(BigDecimal value) {
		return value != null && value.signum() > 0;
	}

	public static boolean withinCent(BigDecimal left, BigDecimal right) {
		return orZero(left).subtract(orZero(right)).abs().compareTo(CENT) <= 0;
	}
}

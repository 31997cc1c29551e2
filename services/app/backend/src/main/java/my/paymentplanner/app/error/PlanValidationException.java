package my.paymentplanner.app.error;

import java.math.BigDecimal;

/**
 * A requested value fell outside its permitted range. {@code bound} is the nearest permitted
 * value when one exists, so callers can show how far the request was off.
 */
public class PlanValidationException extends PlanEngineException {
	private final String field;
	private final BigDecimal requested;
	private final BigDecimal bound;

	public PlanValidationException(String field, String message) {
		this(field, null, null, message);
	}

	public PlanValidationException(String field, BigDecimal requested, BigDecimal bound, String message) {
		super(ErrorKind.VALIDATION, message);
		this.field = field;
		this.requested = requested;
		this.bound = bound;
	}

	public String getField() {
		return field;
	}

	public BigDecimal getRequested() {
		return requested;
	}

	public BigDecimal getBound() {
		return bound;
	}

	public BigDecimal getDelta() {
		if (requested == null || bound == null) {
			return null;
		}
		return bound.subtract(requested);
	}
}

package my.paymentplanner.app.error;

/**
 * Base type for every failure the plan engine reports to its callers. The {@link ErrorKind}
 * travels unchanged to the REST boundary and to editor listeners.
 */
public abstract class PlanEngineException extends RuntimeException {
	private final ErrorKind kind;

	protected PlanEngineException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	protected PlanEngineException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}
}

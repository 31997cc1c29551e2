package my.paymentplanner.app.error;

public class InvalidTransitionException extends PlanEngineException {
	public static final String MISSING = "MISSING";

	private final Long versionId;
	private final String attempted;
	private final String actual;

	public InvalidTransitionException(Long versionId, String attempted, String actual) {
		super(ErrorKind.INVALID_TRANSITION,
				"Cannot " + attempted + " plan version " + versionId + " in state " + actual);
		this.versionId = versionId;
		this.attempted = attempted;
		this.actual = actual;
	}

	public static InvalidTransitionException missing(Long versionId, String attempted) {
		return new InvalidTransitionException(versionId, attempted, MISSING);
	}

	public Long getVersionId() {
		return versionId;
	}

	public String getAttempted() {
		return attempted;
	}

	public String getActual() {
		return actual;
	}
}

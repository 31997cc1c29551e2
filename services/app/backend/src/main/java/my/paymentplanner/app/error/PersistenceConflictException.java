package my.paymentplanner.app.error;

public class PersistenceConflictException extends PlanEngineException {
	public PersistenceConflictException(String message) {
		super(ErrorKind.PERSISTENCE_CONFLICT, message);
	}

	public PersistenceConflictException(String message, Throwable cause) {
		super(ErrorKind.PERSISTENCE_CONFLICT, message, cause);
	}
}

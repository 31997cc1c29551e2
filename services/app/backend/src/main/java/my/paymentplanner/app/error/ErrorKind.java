package my.paymentplanner.app.error;

public enum ErrorKind {
	CONFIGURATION_UNAVAILABLE,
	VALIDATION,
	INVALID_TRANSITION,
	STALE_RESULT_DISCARDED,
	CALCULATION_SERVICE,
	PERSISTENCE_CONFLICT
}

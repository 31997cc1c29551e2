package my.paymentplanner.app.error;

public class CalculationServiceException extends PlanEngineException {
	public CalculationServiceException(String message, Throwable cause) {
		super(ErrorKind.CALCULATION_SERVICE, message, cause);
	}
}

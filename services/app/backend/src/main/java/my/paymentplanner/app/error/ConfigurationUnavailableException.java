package my.paymentplanner.app.error;

public class ConfigurationUnavailableException extends PlanEngineException {
	public ConfigurationUnavailableException(String message) {
		super(ErrorKind.CONFIGURATION_UNAVAILABLE, message);
	}
}

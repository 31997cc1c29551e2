package my.paymentplanner.app.domain;

public enum CalculationMode {
	PERCENT_OF_CURRENT,
	DESIRED_AMOUNT,
	DESIRED_DURATION
}

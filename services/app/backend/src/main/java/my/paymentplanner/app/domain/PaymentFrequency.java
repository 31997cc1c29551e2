package my.paymentplanner.app.domain;

public enum PaymentFrequency {
	WEEKLY,
	MONTHLY
}

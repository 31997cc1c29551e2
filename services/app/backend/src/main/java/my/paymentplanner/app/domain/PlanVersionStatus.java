package my.paymentplanner.app.domain;

public enum PlanVersionStatus {
	DRAFT,
	ACTIVE,
	SUSPENDED,
	ARCHIVED
}

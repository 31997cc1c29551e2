package my.paymentplanner.app.domain;

public enum ProgramType {
	STANDARD_SPLIT,
	DEBT_FOCUSED,
	NO_FEE_VARIANT;

	public boolean impliesNoFee() {
		return this == NO_FEE_VARIANT;
	}
}

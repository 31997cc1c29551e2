package my.paymentplanner.app.editor;

public enum GridField {
	PAYMENT_DATE(false, true),
	PAYMENT_AMOUNT(true, true),
	SETUP_FEE(true, true),
	PROGRAM_FEE(true, true),
	BANKING_FEE(true, true),
	SECONDARY_BANKING_FEE(true, true),
	ADDITIONAL_PRODUCTS(true, true),
	ESCROW_AMOUNT(true, false);

	private final boolean monetary;
	private final boolean editable;

	GridField(boolean monetary, boolean editable) {
		this.monetary = monetary;
		this.editable = editable;
	}

	public boolean isMonetary() {
		return monetary;
	}

	/**
	 * Escrow is derived from the other amounts and never typed in.
	 */
	public boolean isEditable() {
		return editable;
	}
}

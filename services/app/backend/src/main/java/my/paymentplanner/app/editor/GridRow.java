package my.paymentplanner.app.editor;

import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.dto.ScheduleItemDto;
import my.paymentplanner.app.dto.ScheduleRowEdit;
import my.paymentplanner.app.service.util.Money;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One row of the editing grid. {@code persistedStatus} is the status the row was loaded with and
 * decides whether cells may be edited; {@code status} is what the editor will submit.
 */
public record GridRow(
		String rowKey,
		Long itemId,
		int sequenceNumber,
		LocalDate paymentDate,
		BigDecimal paymentAmount,
		BigDecimal setupFee,
		BigDecimal programFee,
		BigDecimal bankingFee,
		BigDecimal secondaryBankingFee,
		BigDecimal additionalProducts,
		BigDecimal escrowAmount,
		ScheduleItemStatus status,
		ScheduleItemStatus persistedStatus,
		boolean modified,
		boolean newRow,
		boolean deleted,
		Map<GridField, String> editBuffers
) {
	public GridRow {
		editBuffers = editBuffers == null || editBuffers.isEmpty() ? Map.of() : Map.copyOf(editBuffers);
	}

	public static GridRow fromItem(ScheduleItemDto item) {
		return new GridRow("item-" + item.id(), item.id(), item.sequenceNumber(), item.paymentDate(),
				Money.round(item.paymentAmount()), Money.round(item.setupFeePortion()),
				Money.round(item.programFeePortion()), Money.round(item.bankingFeePortion()),
				Money.round(item.secondaryBankingFeePortion()), Money.round(item.additionalProductsPortion()),
				Money.round(item.escrowAmount()), item.status(), item.status(), false, false, false, Map.of());
	}

	public static GridRow added(String rowKey, int sequenceNumber, LocalDate paymentDate, RowDefaults defaults) {
		GridRow row = new GridRow(rowKey, null, sequenceNumber, paymentDate, Money.ZERO, Money.ZERO, Money.ZERO,
				Money.round(defaults.bankingFee()), Money.round(defaults.secondaryBankingFee()),
				Money.round(defaults.additionalProducts()), Money.ZERO, ScheduleItemStatus.SCHEDULED,
				ScheduleItemStatus.SCHEDULED, true, true, false, Map.of());
		return row.withRecomputedEscrow();
	}

	public boolean isLocked() {
		return persistedStatus.isFrozen();
	}

	public BigDecimal money(GridField field) {
		return switch (field) {
			case PAYMENT_AMOUNT -> paymentAmount;
			case SETUP_FEE -> setupFee;
			case PROGRAM_FEE -> programFee;
			case BANKING_FEE -> bankingFee;
			case SECONDARY_BANKING_FEE -> secondaryBankingFee;
			case ADDITIONAL_PRODUCTS -> additionalProducts;
			case ESCROW_AMOUNT -> escrowAmount;
			case PAYMENT_DATE -> throw new IllegalArgumentException("Payment date is not an amount");
		};
	}

	public Object value(GridField field) {
		return field == GridField.PAYMENT_DATE ? paymentDate : money(field);
	}

	public GridRow withValue(GridField field, Object value) {
		if (field == GridField.PAYMENT_DATE) {
			return withDate((LocalDate) value);
		}
		return withMoney(field, (BigDecimal) value);
	}

	/**
	 * Sets an amount and derives escrow again.
	 */
	public GridRow withMoney(GridField field, BigDecimal value) {
		BigDecimal amount = Money.round(value);
		GridRow updated = new GridRow(rowKey, itemId, sequenceNumber, paymentDate,
				field == GridField.PAYMENT_AMOUNT ? amount : paymentAmount,
				field == GridField.SETUP_FEE ? amount : setupFee,
				field == GridField.PROGRAM_FEE ? amount : programFee,
				field == GridField.BANKING_FEE ? amount : bankingFee,
				field == GridField.SECONDARY_BANKING_FEE ? amount : secondaryBankingFee,
				field == GridField.ADDITIONAL_PRODUCTS ? amount : additionalProducts,
				escrowAmount, status, persistedStatus, true, newRow, deleted, editBuffers);
		return updated.withRecomputedEscrow();
	}

	public GridRow withDate(LocalDate value) {
		return new GridRow(rowKey, itemId, sequenceNumber, value, paymentAmount, setupFee, programFee, bankingFee,
				secondaryBankingFee, additionalProducts, escrowAmount, status, persistedStatus, true, newRow, deleted,
				editBuffers);
	}

	public GridRow withStatus(ScheduleItemStatus value) {
		return new GridRow(rowKey, itemId, sequenceNumber, paymentDate, paymentAmount, setupFee, programFee, bankingFee,
				secondaryBankingFee, additionalProducts, escrowAmount, value, persistedStatus, true, newRow, deleted,
				editBuffers);
	}

	public GridRow withRecomputedEscrow() {
		BigDecimal escrow = paymentAmount.subtract(bankingFee)
				.subtract(secondaryBankingFee)
				.subtract(programFee)
				.subtract(setupFee)
				.subtract(additionalProducts);
		return new GridRow(rowKey, itemId, sequenceNumber, paymentDate, paymentAmount, setupFee, programFee, bankingFee,
				secondaryBankingFee, additionalProducts, Money.round(escrow), status, persistedStatus, modified, newRow,
				deleted, editBuffers);
	}

	public Optional<String> buffer(GridField field) {
		return Optional.ofNullable(editBuffers.get(field));
	}

	public GridRow withBuffer(GridField field, String raw) {
		Map<GridField, String> buffers = new EnumMap<>(GridField.class);
		buffers.putAll(editBuffers);
		buffers.put(field, raw == null ? "" : raw);
		return new GridRow(rowKey, itemId, sequenceNumber, paymentDate, paymentAmount, setupFee, programFee, bankingFee,
				secondaryBankingFee, additionalProducts, escrowAmount, status, persistedStatus, true, newRow, deleted,
				buffers);
	}

	public GridRow withoutBuffer(GridField field) {
		if (!editBuffers.containsKey(field)) {
			return this;
		}
		Map<GridField, String> buffers = new EnumMap<>(GridField.class);
		buffers.putAll(editBuffers);
		buffers.remove(field);
		return new GridRow(rowKey, itemId, sequenceNumber, paymentDate, paymentAmount, setupFee, programFee, bankingFee,
				secondaryBankingFee, additionalProducts, escrowAmount, status, persistedStatus, modified, newRow, deleted,
				buffers);
	}

	public GridRow markedDeleted() {
		return new GridRow(rowKey, itemId, sequenceNumber, paymentDate, paymentAmount, setupFee, programFee, bankingFee,
				secondaryBankingFee, additionalProducts, escrowAmount, status, persistedStatus, true, newRow, true,
				editBuffers);
	}

	public ScheduleRowEdit toEdit() {
		return new ScheduleRowEdit(itemId, paymentDate, paymentAmount, setupFee, programFee, bankingFee,
				secondaryBankingFee, additionalProducts, status);
	}
}

package my.paymentplanner.app.model;

import my.paymentplanner.app.domain.ScheduleItemStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ScheduleLine(
		int sequenceNumber,
		LocalDate paymentDate,
		BigDecimal paymentAmount,
		BigDecimal setupFeePortion,
		BigDecimal programFeePortion,
		BigDecimal bankingFeePortion,
		BigDecimal secondaryBankingFeePortion,
		BigDecimal additionalProductsPortion,
		BigDecimal escrowAmount,
		BigDecimal runningBalance,
		ScheduleItemStatus status
) {
	public boolean isLocked() {
		return status.isFrozen();
	}

	/**
	 * The part of the payment that goes toward the settlement and program fee.
	 */
	public BigDecimal contribution() {
		return programFeePortion.add(escrowAmount);
	}

	public BigDecimal portionsTotal() {
		return setupFeePortion.add(programFeePortion)
				.add(bankingFeePortion)
				.add(secondaryBankingFeePortion)
				.add(additionalProductsPortion)
				.add(escrowAmount);
	}

	public ScheduleLine withStatus(ScheduleItemStatus value) {
		return new ScheduleLine(sequenceNumber, paymentDate, paymentAmount, setupFeePortion, programFeePortion,
				bankingFeePortion, secondaryBankingFeePortion, additionalProductsPortion, escrowAmount,
				runningBalance, value);
	}
}

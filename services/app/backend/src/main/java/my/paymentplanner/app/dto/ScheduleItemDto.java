package my.paymentplanner.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import my.paymentplanner.app.domain.ScheduleItemStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ScheduleItemDto(
		Long id,
		int sequenceNumber,
		@Schema(description = "Draft number; null for NSF and cancelled rows.")
		Integer draftNumber,
		LocalDate paymentDate,
		BigDecimal paymentAmount,
		BigDecimal setupFeePortion,
		BigDecimal programFeePortion,
		BigDecimal bankingFeePortion,
		BigDecimal secondaryBankingFeePortion,
		BigDecimal additionalProductsPortion,
		BigDecimal escrowAmount,
		BigDecimal runningBalance,
		ScheduleItemStatus status,
		boolean locked,
		boolean editable,
		@Schema(description = "Differs from the row with the same sequence number in the superseded version.")
		boolean changedFromPrevious
) {
}

package my.paymentplanner.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import my.paymentplanner.app.domain.ScheduleItemStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ScheduleRowEdit(
		@Schema(description = "Existing schedule item id; null for rows added in the editor.")
		Long itemId,
		@NotNull LocalDate paymentDate,
		BigDecimal paymentAmount,
		BigDecimal setupFeePortion,
		BigDecimal programFeePortion,
		BigDecimal bankingFeePortion,
		BigDecimal secondaryBankingFeePortion,
		BigDecimal additionalProductsPortion,
		ScheduleItemStatus status
) {
}

package my.paymentplanner.app.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record WireFeeDto(
		Long id,
		Long scheduleItemId,
		String feeType,
		BigDecimal amount,
		LocalDateTime createdAt
) {
}

package my.paymentplanner.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

public record ScheduleTotalsDto(
		int rowCount,
		@Schema(description = "Payments excluding NSF rows, plus wires received.")
		BigDecimal totalDraftAmount,
		BigDecimal totalSetupFee,
		BigDecimal totalProgramFee,
		BigDecimal totalBankingFee,
		BigDecimal totalSavings,
		BigDecimal totalWiresReceived,
		BigDecimal clearedDraftAmount,
		BigDecimal clearedSetupFee,
		BigDecimal clearedProgramFee,
		BigDecimal clearedBankingFee,
		BigDecimal clearedSavings,
		BigDecimal nsfDraftAmount,
		BigDecimal nsfSetupFee,
		BigDecimal nsfProgramFee,
		BigDecimal nsfBankingFee,
		BigDecimal nsfSavings
) {
}

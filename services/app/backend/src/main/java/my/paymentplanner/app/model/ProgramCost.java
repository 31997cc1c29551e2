package my.paymentplanner.app.model;

import java.math.BigDecimal;

public record ProgramCost(
		BigDecimal settlementAmount,
		BigDecimal programFee,
		BigDecimal baselineProgramFee,
		BigDecimal totalProgramCost
) {
}

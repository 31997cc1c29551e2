package my.paymentplanner.app.editor;

import my.paymentplanner.app.model.PlanConfiguration;
import my.paymentplanner.app.service.util.Money;

import java.math.BigDecimal;

/**
 * Fee values a row added by hand starts with. They come from the plan configuration, never from
 * neighbouring rows.
 */
public record RowDefaults(
		BigDecimal bankingFee,
		BigDecimal secondaryBankingFee,
		BigDecimal additionalProducts
) {
	public static RowDefaults from(PlanConfiguration configuration) {
		return new RowDefaults(Money.round(configuration.bankingFee()),
				Money.round(configuration.secondaryBankingFee()),
				Money.round(configuration.additionalWeeklyProductsTotal()));
	}
}
